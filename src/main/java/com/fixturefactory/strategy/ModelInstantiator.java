package com.fixturefactory.strategy;

/**
 * Turns resolved arguments into a model instance (the BUILD strategy).
 */
@FunctionalInterface
public interface ModelInstantiator {

    Object instantiate(Class<?> model, Arguments arguments);
}
