package com.fixturefactory.strategy;

/**
 * Instantiates and persists a model instance (the CREATE strategy).
 * Exceptions thrown here reach the caller unchanged.
 */
@FunctionalInterface
public interface Persister {

    Object instantiateAndPersist(Class<?> model, Arguments arguments, ModelInstantiator instantiator);
}
