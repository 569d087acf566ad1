package com.fixturefactory.declaration;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

import com.fixturefactory.Factory;
import com.fixturefactory.builder.Resolver;

/**
 * Static shorthands for every declaration, meant to be imported with {@code import static}.
 */
public final class Declarations {

    private Declarations() {
        // Utility class
    }

    public static Sequence sequence(IntFunction<?> function) {
        return new Sequence(function);
    }

    public static LazyAttributeSequence lazyAttributeSequence(BiFunction<Resolver, Integer, ?> function) {
        return new LazyAttributeSequence(function);
    }

    public static LazyFunction lazyFunction(Supplier<?> function) {
        return new LazyFunction(function);
    }

    public static LazyAttribute lazyAttribute(Function<Resolver, ?> function) {
        return new LazyAttribute(function);
    }

    public static SelfAttribute selfAttribute(String path) {
        return new SelfAttribute(path);
    }

    public static SelfAttribute selfAttribute(String path, Object defaultValue) {
        return new SelfAttribute(path, defaultValue);
    }

    public static ContainerAttribute containerAttribute(BiFunction<Resolver, List<Resolver>, ?> function) {
        return new ContainerAttribute(function, true);
    }

    public static ContainerAttribute containerAttribute(BiFunction<Resolver, List<Resolver>, ?> function, boolean strict) {
        return new ContainerAttribute(function, strict);
    }

    /**
     * Cycles through {@code values} forever.
     */
    public static IteratorDeclaration iterator(Iterable<?> values) {
        return new IteratorDeclaration(values, true, null);
    }

    public static IteratorDeclaration iterator(Iterable<?> values, boolean cycle, Function<Object, ?> getter) {
        return new IteratorDeclaration(values, cycle, getter);
    }

    public static SubFactory subFactory(Factory<?> factory) {
        return new SubFactory(factory, Map.of());
    }

    public static SubFactory subFactory(Factory<?> factory, Map<String, Object> defaults) {
        return new SubFactory(factory, defaults);
    }

    /**
     * Sub-factory resolved on first use, for factories referencing each other.
     */
    public static SubFactory subFactory(Supplier<? extends Factory<?>> factory, Map<String, Object> defaults) {
        return new SubFactory(factory, defaults);
    }

    public static Dict dict(Map<String, Object> params) {
        return new Dict(params);
    }

    public static ListDeclaration list(List<?> params) {
        return new ListDeclaration(params);
    }

    public static Maybe maybe(Object decider, Object yes, Object no) {
        return new Maybe(decider, yes, no);
    }

    public static Maybe maybe(Object decider, Object yes) {
        return new Maybe(decider, yes, Skip.SKIP);
    }

    public static Trait trait(Map<String, Object> overrides) {
        return new Trait(overrides);
    }

    public static Transformer transformer(Function<Object, ?> transform, Object defaultValue) {
        return new Transformer(transform, defaultValue);
    }

    public static PostGeneration postGeneration(PostGenerationHook hook) {
        return new PostGeneration(hook);
    }

    public static PostGenerationMethodCall postGenerationMethodCall(String methodName, Object... args) {
        return new PostGenerationMethodCall(methodName, Arrays.asList(args), Map.of());
    }

    public static PostGenerationMethodCall postGenerationMethodCall(String methodName, List<?> args, Map<String, Object> kwargs) {
        return new PostGenerationMethodCall(methodName, args, kwargs);
    }

    public static RelatedFactory relatedFactory(Factory<?> factory, String relatedName) {
        return new RelatedFactory(factory, relatedName, Map.of());
    }

    public static RelatedFactory relatedFactory(Factory<?> factory, String relatedName, Map<String, Object> defaults) {
        return new RelatedFactory(factory, relatedName, defaults);
    }

    public static RelatedFactoryList relatedFactoryList(Factory<?> factory, String relatedName, int size) {
        return new RelatedFactoryList(factory, relatedName, () -> size, Map.of());
    }

    public static RelatedFactoryList relatedFactoryList(Factory<?> factory, String relatedName, IntSupplier size,
                                                        Map<String, Object> defaults) {
        return new RelatedFactoryList(factory, relatedName, size, defaults);
    }
}
