package com.fixturefactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.IntSupplier;

import com.fixturefactory.builder.Resolver;
import com.fixturefactory.declaration.LazyAttribute;
import com.fixturefactory.declaration.PostGeneration;
import com.fixturefactory.declaration.PostGenerationHook;
import com.fixturefactory.declaration.Sequence;
import com.fixturefactory.declaration.Trait;
import com.fixturefactory.options.AfterPostGenerationHook;
import com.fixturefactory.options.FactoryOptions;
import com.fixturefactory.options.KwargsAdjuster;
import com.fixturefactory.options.ModelReference;
import com.fixturefactory.strategy.Arguments;
import com.fixturefactory.strategy.ModelInstantiator;
import com.fixturefactory.strategy.Persister;
import com.fixturefactory.strategy.Strategy;

/**
 * Fluent definition of a {@link Factory}. Declarations keep the order in which they are set.
 *
 * <pre>{@code
 * Factory<User> users = Factory.define(User.class)
 *         .set("first_name", "Jack")
 *         .sequence("email", n -> "user" + n + "@example.com")
 *         .trait("admin", Kwargs.of("role", "ADMIN"))
 *         .build();
 * }</pre>
 *
 * @param <T> model type
 */
public final class FactoryDefinition<T> {

    private final FactoryOptions parent;
    private final ModelReference model;

    private final Map<String, Object> declarations = new LinkedHashMap<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    private String name;
    private Boolean abstractFactory;
    private Set<String> exclude;
    private Map<String, String> rename;
    private List<String> inlineArgs;
    private Strategy strategy;
    private ModelInstantiator instantiator;
    private Persister persister;
    private KwargsAdjuster kwargsAdjuster;
    private AfterPostGenerationHook afterPostGeneration;
    private IntSupplier initialSequence;
    private FactoryRuntime runtime;
    private Boolean stubbable;

    FactoryDefinition(FactoryOptions parent, ModelReference model) {
        this.parent = parent;
        this.model = model;
    }

    /**
     * Declares {@code name}. Raw values are used as-is; a {@link Trait} is registered as a parameter.
     * Names may be nested ({@code owner__name}) to override a sub-factory's declaration.
     */
    public FactoryDefinition<T> set(String name, Object value) {
        if (value instanceof Trait) {
            parameters.put(name, value);
        } else {
            declarations.put(name, value);
        }
        return this;
    }

    public FactoryDefinition<T> setAll(Map<String, ?> values) {
        values.forEach(this::set);
        return this;
    }

    public FactoryDefinition<T> sequence(String name, IntFunction<?> function) {
        return set(name, new Sequence(function));
    }

    public FactoryDefinition<T> lazy(String name, Function<Resolver, ?> function) {
        return set(name, new LazyAttribute(function));
    }

    public FactoryDefinition<T> trait(String name, Map<String, Object> overrides) {
        parameters.put(name, new Trait(overrides));
        return this;
    }

    /**
     * A value available to other declarations but never passed to the model.
     */
    public FactoryDefinition<T> param(String name, Object value) {
        parameters.put(name, value);
        return this;
    }

    /**
     * Runs {@code hook} once the object exists; under STUB it receives the stub.
     */
    public FactoryDefinition<T> postGeneration(String name, PostGenerationHook hook) {
        return set(name, new PostGeneration(hook));
    }

    public FactoryDefinition<T> named(String name) {
        this.name = name;
        return this;
    }

    public FactoryDefinition<T> abstractFactory() {
        this.abstractFactory = Boolean.TRUE;
        return this;
    }

    /**
     * Attributes resolved but never passed to the model, added to those the parent excludes.
     */
    public FactoryDefinition<T> exclude(String... names) {
        if (this.exclude == null) {
            this.exclude = new LinkedHashSet<>(parent != null ? parent.getExclude() : Set.of());
        }
        this.exclude.addAll(Arrays.asList(names));
        return this;
    }

    /**
     * Passes attribute {@code from} to the model as {@code to}.
     */
    public FactoryDefinition<T> rename(String from, String to) {
        if (this.rename == null) {
            this.rename = new LinkedHashMap<>(parent != null ? parent.getRename() : Map.of());
        }
        this.rename.put(from, to);
        return this;
    }

    /**
     * Attributes passed to the model positionally, in this order, after renaming.
     */
    public FactoryDefinition<T> inlineArgs(String... names) {
        this.inlineArgs = Arrays.asList(names);
        return this;
    }

    public FactoryDefinition<T> strategy(Strategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public FactoryDefinition<T> instantiatedWith(ModelInstantiator instantiator) {
        this.instantiator = instantiator;
        return this;
    }

    public FactoryDefinition<T> constructedBy(Function<Arguments, ? extends T> constructor) {
        return instantiatedWith((modelClass, arguments) -> constructor.apply(arguments));
    }

    public FactoryDefinition<T> persistedWith(Persister persister) {
        this.persister = persister;
        return this;
    }

    public FactoryDefinition<T> adjustKwargs(KwargsAdjuster adjuster) {
        this.kwargsAdjuster = adjuster;
        return this;
    }

    public FactoryDefinition<T> afterPostGeneration(AfterPostGenerationHook hook) {
        this.afterPostGeneration = hook;
        return this;
    }

    public FactoryDefinition<T> initialSequence(int value) {
        return initialSequence(() -> value);
    }

    /**
     * First sequence value, computed when the counter is first used or reset.
     */
    public FactoryDefinition<T> initialSequence(IntSupplier supplier) {
        this.initialSequence = supplier;
        return this;
    }

    public FactoryDefinition<T> runtime(FactoryRuntime runtime) {
        this.runtime = runtime;
        return this;
    }

    FactoryDefinition<T> notStubbable() {
        this.stubbable = Boolean.FALSE;
        return this;
    }

    /**
     * @throws com.fixturefactory.exception.InvalidDeclarationException if the declarations are inconsistent
     */
    public Factory<T> build() {
        FactoryOptions options = FactoryOptions.builder()
                .name(name)
                .parent(parent)
                .model(model)
                .abstractFactory(abstractFactory)
                .exclude(exclude)
                .rename(rename)
                .inlineArgs(inlineArgs)
                .strategy(strategy)
                .declarations(declarations)
                .parameters(parameters)
                .instantiator(instantiator)
                .persister(persister)
                .kwargsAdjuster(kwargsAdjuster)
                .afterPostGeneration(afterPostGeneration)
                .initialSequence(initialSequence)
                .runtime(runtime)
                .stubbable(stubbable)
                .build();
        return new Factory<>(options);
    }
}
