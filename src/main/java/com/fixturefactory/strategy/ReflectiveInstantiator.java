package com.fixturefactory.strategy;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.exception.ModelInstantiationException;
import com.fixturefactory.util.NamingUtil;
import com.fixturefactory.util.Reflection;

/**
 * Default BUILD behaviour.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>records: canonical constructor, positional args first, then components by name;</li>
 *   <li>{@link Map} models: no-arg constructor then {@code putAll};</li>
 *   <li>a constructor whose parameter names (compiled with {@code -parameters}) match the keyword arguments;</li>
 *   <li>a constructor matching the positional arguments, then setters or fields for the keyword arguments.</li>
 * </ol>
 * Keyword names may be snake_case; they are matched against camelCase members.
 */
public class ReflectiveInstantiator implements ModelInstantiator {
    private static final Logger log = LoggerFactory.getLogger(ReflectiveInstantiator.class);

    public static final ReflectiveInstantiator INSTANCE = new ReflectiveInstantiator();

    @Override
    public Object instantiate(Class<?> model, Arguments arguments) {
        if (model.isRecord()) {
            return instantiateRecord(model, arguments);
        }
        if (Map.class.isAssignableFrom(model)) {
            return instantiateMap(model, arguments);
        }

        Optional<Constructor<?>> named = findNamedConstructor(model, arguments);
        if (named.isPresent()) {
            return Reflection.newInstance(named.get(), namedConstructorArguments(named.get(), arguments));
        }
        return instantiateBean(model, arguments);
    }

    private Object instantiateRecord(Class<?> model, Arguments arguments) {
        RecordComponent[] components = model.getRecordComponents();
        if (arguments.getArgs().size() > components.length) {
            throw new ModelInstantiationException(String.format(
                    "Record %s has %d components but %d positional arguments were given",
                    model.getName(), components.length, arguments.getArgs().size()));
        }

        Object[] values = new Object[components.length];
        Class<?>[] types = new Class<?>[components.length];
        Map<String, Object> remaining = new LinkedHashMap<>(arguments.getKwargs());

        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            types[i] = component.getType();
            if (i < arguments.getArgs().size()) {
                values[i] = arguments.getArgs().get(i);
            } else {
                String key = matchingKey(remaining, component.getName());
                values[i] = key != null ? remaining.remove(key) : Reflection.defaultValue(component.getType());
            }
        }

        if (!remaining.isEmpty()) {
            throw new ModelInstantiationException(String.format(
                    "Record %s has no components named %s", model.getName(), remaining.keySet()));
        }

        try {
            return Reflection.newInstance(model.getDeclaredConstructor(types), values);
        } catch (NoSuchMethodException e) {
            throw new ModelInstantiationException("No canonical constructor on record " + model.getName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Object instantiateMap(Class<?> model, Arguments arguments) {
        if (!arguments.getArgs().isEmpty()) {
            throw new ModelInstantiationException("Map model " + model.getName() + " does not accept positional arguments");
        }
        Class<?> concrete = model.isInterface() ? LinkedHashMap.class : model;
        try {
            Map<String, Object> map = (Map<String, Object>) Reflection.newInstance(concrete.getDeclaredConstructor(), new Object[0]);
            map.putAll(arguments.getKwargs());
            return map;
        } catch (NoSuchMethodException e) {
            throw new ModelInstantiationException("Map model " + model.getName() + " has no no-arg constructor", e);
        }
    }

    private Optional<Constructor<?>> findNamedConstructor(Class<?> model, Arguments arguments) {
        int expected = arguments.getArgs().size() + arguments.getKwargs().size();
        if (arguments.getKwargs().isEmpty()) {
            return Optional.empty();
        }
        for (Constructor<?> constructor : model.getDeclaredConstructors()) {
            Parameter[] parameters = constructor.getParameters();
            if (parameters.length != expected || !parameters[0].isNamePresent()) {
                continue;
            }
            Object[] values = namedConstructorArguments(constructor, arguments);
            if (values != null && Reflection.isCompatible(constructor, Arrays.asList(values))) {
                return Optional.of(constructor);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the argument array, or {@code null} when a parameter name has no matching keyword
     */
    private Object[] namedConstructorArguments(Constructor<?> constructor, Arguments arguments) {
        Parameter[] parameters = constructor.getParameters();
        Object[] values = new Object[parameters.length];
        Map<String, Object> remaining = new LinkedHashMap<>(arguments.getKwargs());
        int positional = arguments.getArgs().size();

        for (int i = 0; i < parameters.length; i++) {
            if (i < positional) {
                values[i] = arguments.getArgs().get(i);
                continue;
            }
            String key = matchingKey(remaining, parameters[i].getName());
            if (key == null) {
                return null;
            }
            values[i] = remaining.remove(key);
        }
        return values;
    }

    private Object instantiateBean(Class<?> model, Arguments arguments) {
        List<Object> positional = new ArrayList<>(arguments.getArgs());
        Constructor<?> constructor = Arrays.stream(model.getDeclaredConstructors())
                .filter(candidate -> Reflection.isCompatible(candidate, positional))
                .findFirst()
                .orElseThrow(() -> new ModelInstantiationException(String.format(
                        "No constructor of %s accepts positional arguments %s (keyword arguments: %s)",
                        model.getName(), positional, arguments.getKwargs().keySet())));

        Object instance = Reflection.newInstance(constructor, positional.toArray());
        arguments.getKwargs().forEach((name, value) -> setProperty(instance, name, value));
        return instance;
    }

    private void setProperty(Object instance, String name, Object value) {
        Optional<Method> setter = Reflection.findSetter(instance.getClass(), name, value);
        if (setter.isPresent()) {
            Reflection.invokeMethod(instance, setter.get().getName(), Collections.singletonList(value), Map.of());
            return;
        }
        Optional<Field> field = Reflection.findField(instance.getClass(), name);
        if (field.isPresent() && Reflection.isCompatible(field.get().getType(), value)) {
            Reflection.writeField(field.get(), instance, value);
            return;
        }
        log.debug("No setter or field for '{}' on {}", name, instance.getClass().getName());
        throw new ModelInstantiationException(String.format(
                "Cannot set '%s' on %s: no compatible setter or field", name, instance.getClass().getName()));
    }

    private String matchingKey(Map<String, Object> kwargs, String memberName) {
        if (kwargs.containsKey(memberName)) {
            return memberName;
        }
        for (String key : kwargs.keySet()) {
            if (memberName.equals(NamingUtil.toCamelCase(key))) {
                return key;
            }
        }
        return null;
    }
}
