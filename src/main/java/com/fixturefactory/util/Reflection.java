package com.fixturefactory.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fixturefactory.exception.ModelInstantiationException;

/**
 * Reflective helpers shared by the default instantiator and method-call declarations.
 * <p>
 * Exceptions thrown by the invoked target are rethrown unchanged when unchecked;
 * checked ones are wrapped in {@link ModelInstantiationException}.
 */
public class Reflection {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class
    );

    private Reflection() {
        // Utility class
    }

    public static boolean isCompatible(Class<?> parameterType, Object argument) {
        if (argument == null) {
            return !parameterType.isPrimitive();
        }
        Class<?> target = parameterType.isPrimitive() ? WRAPPERS.get(parameterType) : parameterType;
        return target.isInstance(argument);
    }

    public static boolean isCompatible(Executable executable, List<Object> arguments) {
        Class<?>[] types = executable.getParameterTypes();
        if (types.length != arguments.size()) {
            return false;
        }
        for (int i = 0; i < types.length; i++) {
            if (!isCompatible(types[i], arguments.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Zero value for primitives, {@code null} otherwise.
     */
    public static Object defaultValue(Class<?> type) {
        if (!type.isPrimitive()) return null;
        if (type == boolean.class) return false;
        if (type == char.class) return '\0';
        if (type == long.class) return 0L;
        if (type == float.class) return 0f;
        if (type == double.class) return 0d;
        if (type == byte.class) return (byte) 0;
        if (type == short.class) return (short) 0;
        return 0;
    }

    public static Object newInstance(Constructor<?> constructor, Object[] arguments) {
        try {
            constructor.setAccessible(true);
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw propagate(e.getCause(), "Constructor of " + constructor.getDeclaringClass().getName() + " failed");
        } catch (ReflectiveOperationException e) {
            throw new ModelInstantiationException("Cannot invoke constructor " + constructor, e);
        }
    }

    /**
     * Invokes the public method {@code name} on {@code target}.
     * Keyword arguments, when present, are passed as a trailing {@code Map} parameter.
     */
    public static Object invokeMethod(Object target, String name, List<Object> arguments, Map<String, Object> keywordArguments) {
        List<Object> callArguments = new ArrayList<>(arguments);
        if (!keywordArguments.isEmpty()) {
            callArguments.add(keywordArguments);
        }

        Method method = findMethod(target.getClass(), name, callArguments)
                .orElseThrow(() -> new ModelInstantiationException(String.format(
                        "No public method %s accepting %d argument(s) %s on %s",
                        name, callArguments.size(), callArguments, target.getClass().getName())));
        try {
            method.trySetAccessible();
            return method.invoke(target, callArguments.toArray());
        } catch (InvocationTargetException e) {
            throw propagate(e.getCause(), "Method " + name + " on " + target.getClass().getName() + " failed");
        } catch (IllegalAccessException e) {
            throw new ModelInstantiationException("Cannot access method " + method, e);
        }
    }

    public static Optional<Method> findMethod(Class<?> type, String name, List<Object> arguments) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name) && isCompatible(method, arguments)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up {@code setXxx(value)} for a property, walking public methods only.
     */
    public static Optional<Method> findSetter(Class<?> type, String property, Object value) {
        String setterName = "set" + NamingUtil.toPascalCase(property);
        return findMethod(type, setterName, Collections.singletonList(value));
    }

    /**
     * Looks up a no-argument accessor: {@code getXxx()}, {@code isXxx()} or {@code xxx()}.
     */
    public static Optional<Method> findGetter(Class<?> type, String property) {
        String pascal = NamingUtil.toPascalCase(property);
        List<String> candidates = List.of("get" + pascal, "is" + pascal, NamingUtil.toCamelCase(property), property);
        for (String candidate : candidates) {
            for (Method method : type.getMethods()) {
                if (method.getName().equals(candidate)
                        && method.getParameterCount() == 0
                        && method.getReturnType() != void.class
                        && !Modifier.isStatic(method.getModifiers())) {
                    return Optional.of(method);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<Field> findField(Class<?> type, String property) {
        String camel = NamingUtil.toCamelCase(property);
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) continue;
                if (field.getName().equals(property) || field.getName().equals(camel)) {
                    return Optional.of(field);
                }
            }
        }
        return Optional.empty();
    }

    public static Object invokeGetter(Method getter, Object target) {
        try {
            getter.trySetAccessible();
            return getter.invoke(target);
        } catch (InvocationTargetException e) {
            throw propagate(e.getCause(), "Accessor " + getter.getName() + " failed");
        } catch (IllegalAccessException e) {
            throw new ModelInstantiationException("Cannot access " + getter, e);
        }
    }

    public static Object readField(Field field, Object target) {
        try {
            field.setAccessible(true);
            return field.get(target);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new ModelInstantiationException("Cannot read field " + field, e);
        }
    }

    public static void writeField(Field field, Object target, Object value) {
        try {
            field.setAccessible(true);
            field.set(target, value);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new ModelInstantiationException("Cannot write field " + field + " with value " + value, e);
        }
    }

    private static RuntimeException propagate(Throwable cause, String message) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new ModelInstantiationException(message + ": " + cause, cause);
    }
}
