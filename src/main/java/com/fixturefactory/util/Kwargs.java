package com.fixturefactory.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds ordered keyword-argument maps. Unlike {@link Map#of}, {@code null} values are allowed,
 * since an explicit {@code null} override is meaningful.
 */
public class Kwargs {

    private Kwargs() {
        // Utility class
    }

    public static Map<String, Object> of() {
        return new LinkedHashMap<>();
    }

    /**
     * @param keysAndValues alternating name / value pairs
     */
    public static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + keysAndValues.length + " elements");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object key = keysAndValues[i];
            if (!(key instanceof String)) {
                throw new IllegalArgumentException("Argument name at position " + i + " is not a String: " + key);
            }
            result.put((String) key, keysAndValues[i + 1]);
        }
        return result;
    }
}
