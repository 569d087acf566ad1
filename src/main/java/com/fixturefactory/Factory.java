package com.fixturefactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.builder.StepBuilder;
import com.fixturefactory.exception.FactoryConfigurationException;
import com.fixturefactory.options.FactoryOptions;
import com.fixturefactory.options.ModelReference;
import com.fixturefactory.strategy.Strategy;
import com.fixturefactory.strategy.StubObject;

/**
 * Generates instances of {@code T} from a set of declarations.
 * <p>
 * Factories are immutable; define them with {@link #define(Class)} and derive children with
 * {@link #extend()}. Every call resolves the declarations afresh, applying the overrides passed
 * at call time: {@code field} replaces a declaration, {@code field__sub} reaches into a
 * sub-factory or post-generation declaration, {@code __sequence} forces the sequence value.
 *
 * @param <T> model type
 */
public final class Factory<T> {
    private static final Logger log = LoggerFactory.getLogger(Factory.class);

    private final FactoryOptions options;

    Factory(FactoryOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public static <T> FactoryDefinition<T> define(Class<T> model) {
        return new FactoryDefinition<>(null, ModelReference.of(model));
    }

    /**
     * Factory for a model loaded by name on first use.
     */
    public static <T> FactoryDefinition<T> define(String className) {
        return new FactoryDefinition<>(null, ModelReference.named(className));
    }

    public static <T> FactoryDefinition<T> define(Supplier<? extends Class<? extends T>> model) {
        return new FactoryDefinition<>(null, ModelReference.lazy(model));
    }

    /**
     * Factory without a model, meant to be extended. Generating from it fails unless its
     * default strategy is {@link Strategy#STUB}.
     */
    public static <T> FactoryDefinition<T> defineAbstract() {
        return new FactoryDefinition<>(null, null);
    }

    /**
     * Child factory inheriting this factory's model, declarations and options.
     */
    public FactoryDefinition<T> extend() {
        return new FactoryDefinition<>(options, null);
    }

    /**
     * Child factory for a different model, typically a subclass of this one's.
     */
    public <S> FactoryDefinition<S> extend(Class<S> model) {
        return new FactoryDefinition<>(options, ModelReference.of(model));
    }

    public String getName() {
        return options.getName();
    }

    public FactoryOptions getOptions() {
        return options;
    }

    public T build() {
        return build(Map.of());
    }

    public T build(Map<String, Object> overrides) {
        return cast(generate(Strategy.BUILD, overrides));
    }

    public T create() {
        return create(Map.of());
    }

    public T create(Map<String, Object> overrides) {
        return cast(generate(Strategy.CREATE, overrides));
    }

    public StubObject stub() {
        return stub(Map.of());
    }

    public StubObject stub(Map<String, Object> overrides) {
        if (!options.isStubbable()) {
            throw new FactoryConfigurationException(getName() + " does not support the STUB strategy");
        }
        return (StubObject) generate(Strategy.STUB, overrides);
    }

    /**
     * Generates with the factory's default strategy.
     */
    public Object generate(Map<String, Object> overrides) {
        return generate(options.getStrategy(), overrides);
    }

    /**
     * @return a {@code T}, or a {@link StubObject} for {@link Strategy#STUB}
     */
    public Object generate(Strategy strategy, Map<String, Object> overrides) {
        FactoryRuntime runtime = options.effectiveRuntime();
        log.debug("Generating {} with {}", getName(), strategy);
        return new StepBuilder(options, overrides, strategy, runtime).build(null, null);
    }

    /**
     * CREATE when {@code create} is true, BUILD otherwise.
     */
    public T simpleGenerate(boolean create, Map<String, Object> overrides) {
        return cast(generate(Strategy.fromCreateFlag(create), overrides));
    }

    public List<T> buildBatch(int size) {
        return buildBatch(size, Map.of());
    }

    /**
     * {@code size} independent build calls with the same overrides; each one advances the sequence.
     */
    public List<T> buildBatch(int size, Map<String, Object> overrides) {
        return batch(size, () -> build(overrides));
    }

    public List<T> createBatch(int size) {
        return createBatch(size, Map.of());
    }

    public List<T> createBatch(int size, Map<String, Object> overrides) {
        return batch(size, () -> create(overrides));
    }

    public List<StubObject> stubBatch(int size) {
        return stubBatch(size, Map.of());
    }

    public List<StubObject> stubBatch(int size, Map<String, Object> overrides) {
        return batch(size, () -> stub(overrides));
    }

    public List<Object> generateBatch(Strategy strategy, int size, Map<String, Object> overrides) {
        return batch(size, () -> generate(strategy, overrides));
    }

    public List<T> simpleGenerateBatch(boolean create, int size, Map<String, Object> overrides) {
        return batch(size, () -> simpleGenerate(create, overrides));
    }

    public void resetSequence() {
        resetSequence(null, false);
    }

    public void resetSequence(Integer value) {
        resetSequence(value, false);
    }

    /**
     * @param value next sequence value, {@code null} for the initial one
     * @param force reset the shared counter even if this factory inherits it from a parent
     * @throws FactoryConfigurationException if this factory inherits its counter and {@code force} is false
     */
    public void resetSequence(Integer value, boolean force) {
        options.resetSequence(value, force);
    }

    private static <V> List<V> batch(int size, Supplier<V> generator) {
        if (size < 0) {
            throw new IllegalArgumentException("Batch size must not be negative: " + size);
        }
        List<V> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(generator.get());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private T cast(Object instance) {
        return (T) instance;
    }

    @Override
    public String toString() {
        return "Factory(" + getName() + ")";
    }
}
