package com.fixturefactory.util;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Maps declaration names (often snake_case) onto Java member names.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts first_name or first-name to FirstName. Already camel-cased input keeps its humps.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_]"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts first_name to firstName.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase() + pascal.substring(1);
    }

    /**
     * Default factory name for a model: {@code User} gives {@code UserFactory}.
     */
    public static String factoryNameFor(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            return "Factory";
        }
        int lastDot = Math.max(modelName.lastIndexOf('.'), modelName.lastIndexOf('$'));
        return modelName.substring(lastDot + 1) + "Factory";
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1);
    }
}
