package com.openapi.simpleSDK.generator.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param propertyName field carrying the variant tag, {@code type} when not declared
 * @param mapping      tag value to schema name, in declaration order
 */
public record Discriminator(String propertyName, Map<String, String> mapping) {
    public static final String DEFAULT_PROPERTY_NAME = "type";

    public Discriminator {
        mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }
}
