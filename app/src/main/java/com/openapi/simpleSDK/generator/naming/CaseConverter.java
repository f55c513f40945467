package com.openapi.simpleSDK.generator.naming;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Conversions between snake_case, camelCase and PascalCase.
 */
public final class CaseConverter {
    private static final Pattern LOWER_THEN_UPPER = Pattern.compile("([a-z\\d])([A-Z])");
    private static final Pattern ACRONYM_THEN_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");

    private CaseConverter() {
    }

    /**
     * {@code camelCase}, {@code PascalCase}, {@code HTTPResponse}, {@code kebab-case} and
     * space separated words all become lower-case words joined by {@code _}.
     */
    public static String toSnakeCase(String text) {
        String normalized = text.replace(' ', '_').replace('-', '_');
        String withUnderscores = LOWER_THEN_UPPER.matcher(normalized).replaceAll("$1_$2");
        return ACRONYM_THEN_WORD.matcher(withUnderscores).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    }

    /** The first word is kept as is, every following word is capitalized. */
    public static String toCamelCase(String text) {
        String[] words = text.split("_", -1);
        StringBuilder builder = new StringBuilder(words[0]);
        for (int i = 1; i < words.length; i++) {
            builder.append(capitalize(words[i]));
        }
        return builder.toString();
    }

    public static String toPascalCase(String text) {
        StringBuilder builder = new StringBuilder();
        for (String word : text.split("_", -1)) {
            builder.append(capitalize(word));
        }
        return builder.toString();
    }

    public static NamingConvention detect(String text) {
        if (text == null || text.isEmpty()) {
            return NamingConvention.UNKNOWN;
        }
        if (text.indexOf('_') >= 0) {
            return isUpperCase(text) ? NamingConvention.SCREAMING_SNAKE_CASE : NamingConvention.SNAKE_CASE;
        }
        if (Character.isUpperCase(text.charAt(0))) {
            return NamingConvention.PASCAL_CASE;
        }
        if (text.chars().anyMatch(Character::isUpperCase)) {
            return NamingConvention.CAMEL_CASE;
        }
        return NamingConvention.UNKNOWN;
    }

    static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    static String decapitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toLowerCase(word.charAt(0)) + word.substring(1);
    }

    private static boolean isUpperCase(String text) {
        boolean cased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            cased |= Character.isUpperCase(c);
        }
        return cased;
    }
}
