package com.fixturefactory.strategy;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.util.Reflection;

/**
 * Default CREATE behaviour: instantiate, then call a public no-argument {@code save()} when the
 * model declares one.
 */
public class SaveMethodPersister implements Persister {
    private static final Logger log = LoggerFactory.getLogger(SaveMethodPersister.class);

    public static final SaveMethodPersister INSTANCE = new SaveMethodPersister();

    private static final String SAVE_METHOD = "save";

    @Override
    public Object instantiateAndPersist(Class<?> model, Arguments arguments, ModelInstantiator instantiator) {
        Object instance = instantiator.instantiate(model, arguments);
        if (Reflection.findMethod(instance.getClass(), SAVE_METHOD, List.of()).isPresent()) {
            Reflection.invokeMethod(instance, SAVE_METHOD, List.of(), Map.of());
        } else {
            log.debug("{} has no save() method; created instance is not persisted", model.getName());
        }
        return instance;
    }
}
