package com.fixturefactory.builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fixturefactory.declaration.Skip;

import lombok.Value;

/**
 * What a post-generation declaration receives from the call-time overrides.
 * <p>
 * {@code value} is the override passed under the declaration's own name; {@code valueProvided}
 * tells an explicit {@code null} apart from no override at all. {@code extra} holds the
 * {@code name__key} overrides keyed by {@code key}. Entries that resolved to {@link Skip#SKIP},
 * such as a switched-off trait override, count as absent.
 */
@Value
public class PostGenerationContext {

    static final String VALUE_KEY = "";

    boolean valueProvided;
    Object value;
    Map<String, Object> extra;

    public static PostGenerationContext from(Map<String, Object> unrolled) {
        Map<String, Object> extra = new LinkedHashMap<>(unrolled);
        extra.values().removeIf(value -> value == Skip.SKIP);
        boolean provided = extra.containsKey(VALUE_KEY);
        Object value = extra.remove(VALUE_KEY);
        return new PostGenerationContext(provided, value, Collections.unmodifiableMap(extra));
    }

    public static PostGenerationContext empty() {
        return new PostGenerationContext(false, null, Map.of());
    }
}
