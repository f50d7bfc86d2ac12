package com.example.deltacode.domain;

/**
 * Names of the factors computed for every delta.
 */
public final class Factors {
    public static final String SIZE_DELTA = "size_delta";
    public static final String PATH_DELTA = "path_delta";
    public static final String ATTRIBUTE_SUFFIX = "_changed";

    private Factors() {}

    public static String attributeFactor(String attributeName) {
        return attributeName + ATTRIBUTE_SUFFIX;
    }

    public static boolean isAttributeFactor(String factorName) {
        return factorName.endsWith(ATTRIBUTE_SUFFIX);
    }
}
