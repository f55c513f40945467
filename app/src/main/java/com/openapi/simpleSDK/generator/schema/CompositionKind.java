package com.openapi.simpleSDK.generator.schema;

/**
 * Composition keywords in the order they are checked.
 */
public enum CompositionKind {
    ALL_OF("allOf"),
    ONE_OF("oneOf"),
    ANY_OF("anyOf");

    private final String keyword;

    CompositionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
