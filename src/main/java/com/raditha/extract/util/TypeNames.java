package com.raditha.extract.util;

import java.util.regex.Pattern;

/**
 * Helpers for turning resolved type descriptions into the short form a developer would write.
 */
public class TypeNames {

    private static final Pattern PACKAGE_QUALIFIER = Pattern.compile("\\b(?:[a-z_][\\w]*\\.)+(?=[A-Z])");

    private TypeNames() {
        /* this is only a utility class */
    }

    /**
     * Strip package qualifiers: {@code java.util.List<java.lang.String>} becomes {@code List<String>}.
     */
    public static String simplify(String described) {
        if (described == null) {
            return null;
        }
        return PACKAGE_QUALIFIER.matcher(described).replaceAll("");
    }

    public static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
