package com.fixturefactory.options;

import java.util.Map;

/**
 * Runs once every post-generation declaration has been applied.
 */
@FunctionalInterface
public interface AfterPostGenerationHook {

    AfterPostGenerationHook NONE = (instance, create, results) -> { };

    /**
     * @param results value returned by each post-generation declaration, by name, in order
     */
    void afterPostGeneration(Object instance, boolean create, Map<String, Object> results);
}
