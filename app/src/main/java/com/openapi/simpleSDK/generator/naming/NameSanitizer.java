package com.openapi.simpleSDK.generator.naming;

import java.util.Locale;
import java.util.Set;

/**
 * Turns arbitrary API names into legal Java identifiers.
 */
public final class NameSanitizer {
    static final Set<String> JAVA_KEYWORDS = Set.of(
        "abstract","assert","boolean","break","byte","case","catch","char","class","const","continue",
        "default","do","double","else","enum","extends","false","final","finally","float","for","goto",
        "if","implements","import","instanceof","int","interface","long","native","new","null","package",
        "private","protected","public","return","short","static","strictfp","super","switch","synchronized",
        "this","throw","throws","transient","true","try","void","volatile","while","record","var","yield"
    );

    private NameSanitizer() {
    }

    public static boolean isKeyword(String name) {
        return JAVA_KEYWORDS.contains(name);
    }

    /**
     * Replaces illegal characters with {@code _}, prefixes a leading digit with {@code n},
     * collapses and trims underscores. An empty result becomes {@code suffix}; a keyword
     * gets {@code suffix} appended.
     */
    public static String sanitizeIdentifier(String name, String suffix) {
        String sanitized = name == null ? "" : name.replaceAll("[^a-zA-Z0-9_]", "_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            sanitized = "n" + sanitized;
        }
        sanitized = sanitized.replaceAll("_+", "_").replaceAll("^_|_$", "");
        if (sanitized.isEmpty()) {
            sanitized = suffix;
        }
        if (JAVA_KEYWORDS.contains(sanitized)) {
            sanitized = sanitized + suffix;
        }
        return sanitized;
    }

    public static String sanitizeIdentifier(String name) {
        return sanitizeIdentifier(name, "Value");
    }

    /** e.g. {@code user-profiles} becomes {@code UserProfiles}. */
    public static String sanitizeClassName(String name) {
        return CaseConverter.toPascalCase(sanitizeIdentifier(name, "Class"));
    }

    /** Lower-case method identifier; {@code import} becomes {@code importOperation}. */
    public static String sanitizeMethodName(String name) {
        String camel = CaseConverter.decapitalize(CaseConverter.toCamelCase(sanitizeIdentifier(name, "Operation")));
        return JAVA_KEYWORDS.contains(camel) ? camel + "Operation" : camel;
    }

    /** A single package segment: lower case, separators folded into {@code _}. */
    public static String sanitizePackageName(String name) {
        String lower = name.toLowerCase(Locale.ROOT).replaceAll("[-\\s]+", "_");
        return sanitizeIdentifier(lower, "sdk");
    }

    public static String sanitizeEnumConstantName(String name) {
        return CaseConverter.toSnakeCase(sanitizeIdentifier(name, "VALUE")).toUpperCase(Locale.ROOT);
    }
}
