package com.fixturefactory.strategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fixturefactory.exception.UnknownAttributeException;
import com.fixturefactory.util.AttributeSource;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Attribute bag produced by the STUB strategy.
 */
@ToString
@EqualsAndHashCode
public final class StubObject implements AttributeSource {

    private final Map<String, Object> attributes;

    public StubObject(Map<String, Object> attributes) {
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public Object get(String name) {
        return getAttribute(name);
    }

    public <V> V get(String name, Class<V> type) {
        return type.cast(getAttribute(name));
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public Object getAttribute(String name) {
        if (!attributes.containsKey(name)) {
            throw new UnknownAttributeException(name, "Stub has no attribute '" + name + "'; attributes are " + attributes.keySet());
        }
        return attributes.get(name);
    }
}
