package com.fixturefactory;

import java.util.List;
import java.util.Map;

import com.fixturefactory.strategy.Strategy;
import com.fixturefactory.strategy.StubObject;

/**
 * One-line factories for ad-hoc fixtures.
 */
public final class Factories {

    private Factories() {
        // Utility class
    }

    /**
     * A factory for {@code model} declaring every entry of {@code declarations}; {@link com.fixturefactory.declaration.Trait}
     * values become traits.
     */
    public static <T> Factory<T> makeFactory(Class<T> model, Map<String, ?> declarations) {
        return Factory.define(model).setAll(declarations).build();
    }

    public static <T> T build(Class<T> model, Map<String, ?> declarations) {
        return makeFactory(model, declarations).build();
    }

    public static <T> List<T> buildBatch(Class<T> model, int size, Map<String, ?> declarations) {
        return makeFactory(model, declarations).buildBatch(size);
    }

    public static <T> T create(Class<T> model, Map<String, ?> declarations) {
        return makeFactory(model, declarations).create();
    }

    public static <T> List<T> createBatch(Class<T> model, int size, Map<String, ?> declarations) {
        return makeFactory(model, declarations).createBatch(size);
    }

    public static StubObject stub(Class<?> model, Map<String, ?> declarations) {
        return makeFactory(model, declarations).stub();
    }

    public static List<StubObject> stubBatch(Class<?> model, int size, Map<String, ?> declarations) {
        return makeFactory(model, declarations).stubBatch(size);
    }

    public static Object generate(Class<?> model, Strategy strategy, Map<String, ?> declarations) {
        return makeFactory(model, declarations).generate(strategy, Map.of());
    }

    public static List<Object> generateBatch(Class<?> model, Strategy strategy, int size, Map<String, ?> declarations) {
        return makeFactory(model, declarations).generateBatch(strategy, size, Map.of());
    }

    public static <T> T simpleGenerate(Class<T> model, boolean create, Map<String, ?> declarations) {
        return makeFactory(model, declarations).simpleGenerate(create, Map.of());
    }

    public static <T> List<T> simpleGenerateBatch(Class<T> model, boolean create, int size, Map<String, ?> declarations) {
        return makeFactory(model, declarations).simpleGenerateBatch(create, size, Map.of());
    }
}
