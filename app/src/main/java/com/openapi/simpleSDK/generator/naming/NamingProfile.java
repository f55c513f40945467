package com.openapi.simpleSDK.generator.naming;

/**
 * Naming conventions an API uses on the wire, for response fields and for parameters.
 */
public record NamingProfile(NamingConvention responseNaming, NamingConvention parameterNaming) {

    public static final NamingProfile DEFAULT = new NamingProfile(NamingConvention.CAMEL_CASE, NamingConvention.CAMEL_CASE);
}
