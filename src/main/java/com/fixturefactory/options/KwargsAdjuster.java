package com.fixturefactory.options;

import java.util.Map;

/**
 * Last chance to rewrite the resolved attributes before exclusion, renaming and inline-argument
 * extraction. Receives a mutable copy and returns the map to use.
 */
@FunctionalInterface
public interface KwargsAdjuster {

    KwargsAdjuster IDENTITY = kwargs -> kwargs;

    Map<String, Object> adjust(Map<String, Object> kwargs);
}
