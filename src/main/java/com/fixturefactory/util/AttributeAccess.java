package com.fixturefactory.util;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fixturefactory.exception.UnknownAttributeException;

/**
 * Dotted-path attribute lookup over resolvers, stubs, maps, lists and plain Java objects.
 */
public class AttributeAccess {

    private AttributeAccess() {
        // Utility class
    }

    public static Object get(Object target, String name) {
        if (target == null) {
            throw new UnknownAttributeException(name, "Cannot read attribute '" + name + "' of null");
        }
        if (target instanceof AttributeSource) {
            return ((AttributeSource) target).getAttribute(name);
        }
        if (target instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) target;
            if (map.containsKey(name)) {
                return map.get(name);
            }
            throw new UnknownAttributeException(name, "Map has no key '" + name + "'; keys are " + map.keySet());
        }
        if (target instanceof List && isIndex(name)) {
            List<?> list = (List<?>) target;
            int index;
            try {
                index = Integer.parseInt(name);
            } catch (NumberFormatException e) {
                throw new UnknownAttributeException(name,
                        "Index " + name + " out of range for list of size " + list.size(), e);
            }
            if (index < list.size()) {
                return list.get(index);
            }
            throw new UnknownAttributeException(name, "Index " + index + " out of range for list of size " + list.size());
        }

        Optional<Method> getter = Reflection.findGetter(target.getClass(), name);
        if (getter.isPresent()) {
            return Reflection.invokeGetter(getter.get(), target);
        }
        Optional<Field> field = Reflection.findField(target.getClass(), name);
        if (field.isPresent()) {
            return Reflection.readField(field.get(), target);
        }
        throw new UnknownAttributeException(name,
                "'" + target.getClass().getName() + "' has no attribute '" + name + "'");
    }

    /**
     * Follows {@code a.b.c} from {@code target}.
     */
    public static Object getPath(Object target, String path) {
        Object current = target;
        for (String segment : path.split("\\.")) {
            current = get(current, segment);
        }
        return current;
    }

    /**
     * Same as {@link #getPath(Object, String)}, falling back to {@code defaultValue}
     * when a segment is missing. Failures while computing a segment that does exist propagate.
     */
    public static Object getPath(Object target, String path, Object defaultValue) {
        Object current = target;
        for (String segment : path.split("\\.")) {
            try {
                current = get(current, segment);
            } catch (UnknownAttributeException e) {
                if (!segment.equals(e.getAttributeName())) {
                    throw e;
                }
                return defaultValue;
            }
        }
        return current;
    }

    private static boolean isIndex(String name) {
        return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
    }
}
