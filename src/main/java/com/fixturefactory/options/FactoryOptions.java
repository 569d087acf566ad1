package com.fixturefactory.options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.FactoryRuntime;
import com.fixturefactory.builder.DeclarationSet;
import com.fixturefactory.builder.ParsedDeclarations;
import com.fixturefactory.declaration.Declaration;
import com.fixturefactory.declaration.Skip;
import com.fixturefactory.declaration.Trait;
import com.fixturefactory.exception.AssociatedClassException;
import com.fixturefactory.exception.FactoryConfigurationException;
import com.fixturefactory.exception.InvalidDeclarationException;
import com.fixturefactory.sequence.SequenceRoot;
import com.fixturefactory.strategy.Arguments;
import com.fixturefactory.strategy.ModelInstantiator;
import com.fixturefactory.strategy.Persister;
import com.fixturefactory.strategy.ReflectiveInstantiator;
import com.fixturefactory.strategy.SaveMethodPersister;
import com.fixturefactory.strategy.Strategy;
import com.fixturefactory.strategy.StubObject;
import com.fixturefactory.util.LazyReference;
import com.fixturefactory.util.NamingUtil;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything a factory knows about itself once its definition and its parent's are merged.
 * <p>
 * Options not given here are inherited from the parent: model, exclude, rename, inline args,
 * default strategy, instantiator, persister and hooks. Declarations merge by name, parent first,
 * a redeclared name keeping its original position. Parameters (traits included) merge the same
 * way and are expanded into declarations once all of them are known.
 */
@Getter
public final class FactoryOptions implements SequenceRoot {
    private static final Logger log = LoggerFactory.getLogger(FactoryOptions.class);

    private final String name;
    private final FactoryOptions parent;
    private final ModelReference model;
    private final boolean abstractFactory;
    private final Set<String> exclude;
    private final Map<String, String> rename;
    private final List<String> inlineArgs;
    private final Strategy strategy;
    private final ModelInstantiator instantiator;
    private final Persister persister;
    private final KwargsAdjuster kwargsAdjuster;
    private final AfterPostGenerationHook afterPostGeneration;
    private final IntSupplier initialSequence;
    private final FactoryRuntime runtime;
    private final boolean stubbable;

    /** Declarations as written, parents included, before parameter expansion. */
    private final Map<String, Object> declarations;

    /** Parameters and traits, parents included. */
    private final Map<String, Object> parameters;

    private final DeclarationSet preDeclarations;
    private final DeclarationSet postDeclarations;

    @Getter(AccessLevel.NONE)
    private final LazyReference<FactoryOptions> counterReference;

    @Builder
    private FactoryOptions(String name, FactoryOptions parent, ModelReference model, Boolean abstractFactory,
                           Set<String> exclude, Map<String, String> rename, List<String> inlineArgs, Strategy strategy,
                           Map<String, Object> declarations, Map<String, Object> parameters,
                           ModelInstantiator instantiator, Persister persister, KwargsAdjuster kwargsAdjuster,
                           AfterPostGenerationHook afterPostGeneration, IntSupplier initialSequence,
                           FactoryRuntime runtime, Boolean stubbable) {
        this.parent = parent;
        this.strategy = inherit(strategy, parent != null ? parent.strategy : null, Strategy.BUILD);

        ModelReference effectiveModel = inherit(model, parent != null ? parent.model : null, null);
        if (effectiveModel == null && this.strategy == Strategy.STUB) {
            effectiveModel = ModelReference.of(StubObject.class);
        }
        this.model = effectiveModel;
        this.abstractFactory = Boolean.TRUE.equals(abstractFactory) || effectiveModel == null;
        this.name = name != null ? name
                : effectiveModel != null ? NamingUtil.factoryNameFor(effectiveModel.describe()) : "AbstractFactory";

        this.exclude = Collections.unmodifiableSet(new LinkedHashSet<>(
                inherit(exclude, parent != null ? parent.exclude : null, Set.of())));
        this.rename = Collections.unmodifiableMap(new LinkedHashMap<>(
                inherit(rename, parent != null ? parent.rename : null, Map.of())));
        this.inlineArgs = List.copyOf(inherit(inlineArgs, parent != null ? parent.inlineArgs : null, List.of()));
        this.instantiator = inherit(instantiator, parent != null ? parent.instantiator : null, ReflectiveInstantiator.INSTANCE);
        this.persister = inherit(persister, parent != null ? parent.persister : null, SaveMethodPersister.INSTANCE);
        this.kwargsAdjuster = inherit(kwargsAdjuster, parent != null ? parent.kwargsAdjuster : null, KwargsAdjuster.IDENTITY);
        this.afterPostGeneration = inherit(afterPostGeneration,
                parent != null ? parent.afterPostGeneration : null, AfterPostGenerationHook.NONE);
        this.initialSequence = inherit(initialSequence, parent != null ? parent.initialSequence : null, () -> 0);
        this.runtime = inherit(runtime, parent != null ? parent.runtime : null, null);
        this.stubbable = inherit(stubbable, parent != null ? parent.stubbable : null, Boolean.TRUE);

        this.declarations = Collections.unmodifiableMap(mergeDeclarations(
                parent != null ? parent.declarations : Map.of(), declarations != null ? declarations : Map.of()));
        Map<String, Object> mergedParameters = new LinkedHashMap<>(parent != null ? parent.parameters : Map.of());
        if (parameters != null) {
            mergedParameters.putAll(parameters);
        }
        this.parameters = Collections.unmodifiableMap(mergedParameters);

        ParsedDeclarations parsed = DeclarationSet.parse(expandParameters(), null, null);
        this.preDeclarations = parsed.getPre();
        this.postDeclarations = parsed.getPost();
        this.counterReference = LazyReference.of(this::findCounterReference, "counter reference of " + this.name);

        log.debug("Defined {} (model={}, abstract={}, pre={}, post={}, parameters={})", this.name,
                effectiveModel, this.abstractFactory, preDeclarations.names(), postDeclarations.names(),
                this.parameters.keySet());
    }

    public boolean isAbstract() {
        return abstractFactory;
    }

    /**
     * @throws AssociatedClassException if the factory is abstract
     */
    public Class<?> getModelClass() {
        ensureConcrete();
        return model.resolve();
    }

    /**
     * @throws AssociatedClassException if the factory is abstract or its model cannot be loaded
     */
    public void ensureConcrete() {
        if (abstractFactory) {
            throw new AssociatedClassException(String.format(
                    "Cannot generate instances of abstract factory %s; declare a model or extend it with a concrete one",
                    name));
        }
        model.resolve();
    }

    /**
     * The options owning the sequence counter used by this factory: the root of the chain of
     * concrete ancestors whose models are supertypes of this one's, or this factory itself.
     */
    public SequenceRoot getCounterReference() {
        return counterReference.get();
    }

    public boolean isCounterRoot() {
        return getCounterReference() == this;
    }

    @Override
    public int initialSequence() {
        return initialSequence.getAsInt();
    }

    /**
     * Runtime used by calls starting at this factory.
     */
    public FactoryRuntime effectiveRuntime() {
        return runtime != null ? runtime : FactoryRuntime.global();
    }

    /**
     * @param value next sequence value, {@code null} for the initial one
     * @param force reset the shared counter even though this factory does not own it
     * @throws FactoryConfigurationException when this factory does not own its counter and {@code force} is false
     */
    public void resetSequence(Integer value, boolean force) {
        SequenceRoot root = getCounterReference();
        if (root != this && !force) {
            throw new FactoryConfigurationException(String.format(
                    "Cannot reset the sequence of %s: it shares the counter of %s. Reset that factory or force it",
                    name, root.getName()));
        }
        effectiveRuntime().getSequences().reset(root, value);
    }

    /**
     * Turns resolved attributes into model arguments: adjust, drop excluded names, parameters and
     * skipped values, rename, then pull out the inline arguments in order.
     *
     * @throws InvalidDeclarationException if an inline argument is missing
     */
    public Arguments prepareArguments(Map<String, Object> attributes) {
        Map<String, Object> adjusted = kwargsAdjuster.adjust(new LinkedHashMap<>(attributes));

        Map<String, Object> kwargs = new LinkedHashMap<>();
        adjusted.forEach((key, value) -> {
            if (exclude.contains(key) || parameters.containsKey(key) || value == Skip.SKIP) {
                return;
            }
            kwargs.put(rename.getOrDefault(key, key), value);
        });

        List<Object> args = new ArrayList<>();
        for (String inline : inlineArgs) {
            if (!kwargs.containsKey(inline)) {
                throw new InvalidDeclarationException(String.format(
                        "Inline argument '%s' of %s has no value; available: %s", inline, name, kwargs.keySet()));
            }
            args.add(kwargs.remove(inline));
        }
        return Arguments.of(args, kwargs);
    }

    public Object instantiate(Strategy requested, Arguments arguments) {
        Strategy effective = requested == Strategy.STUB && !stubbable ? Strategy.BUILD : requested;
        if (effective != Strategy.STUB && getModelClass() == StubObject.class) {
            throw new FactoryConfigurationException(name + " has no model and only supports the STUB strategy");
        }
        switch (effective) {
            case STUB:
                return new StubObject(arguments.getKwargs());
            case CREATE:
                return persister.instantiateAndPersist(getModelClass(), arguments, instantiator);
            case BUILD:
            default:
                return instantiator.instantiate(getModelClass(), arguments);
        }
    }

    public void afterPostGeneration(Object instance, boolean create, Map<String, Object> results) {
        afterPostGeneration.afterPostGeneration(instance, create, results);
    }

    private FactoryOptions findCounterReference() {
        if (parent != null && model != null && parent.model != null && !parent.abstractFactory
                && parent.model.resolve().isAssignableFrom(model.resolve())) {
            return (FactoryOptions) parent.getCounterReference();
        }
        return this;
    }

    /**
     * A raw value given for a field the parent declares as post-generation feeds that declaration
     * instead of replacing it.
     */
    private static Map<String, Object> mergeDeclarations(Map<String, Object> inherited, Map<String, Object> own) {
        Map<String, Object> merged = new LinkedHashMap<>(inherited);
        own.forEach((key, value) -> {
            Object previous = merged.get(key);
            boolean previousIsPost = previous instanceof Declaration && ((Declaration) previous).isPostGeneration();
            if (previousIsPost && !(value instanceof Declaration)) {
                merged.put(DeclarationSet.join(key, ""), value);
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private Map<String, Object> expandParameters() {
        List<String> clashes = new ArrayList<>();
        parameters.keySet().stream().filter(declarations::containsKey).forEach(clashes::add);
        if (!clashes.isEmpty()) {
            throw new InvalidDeclarationException(String.format(
                    "%s: parameters %s are also declared as regular fields", name, clashes));
        }

        Map<String, Object> expanded = new LinkedHashMap<>(declarations);
        parameters.forEach((param, value) -> expanded.put(param, value instanceof Trait ? Boolean.FALSE : value));
        parameters.forEach((param, value) -> {
            if (value instanceof Trait) {
                expanded.putAll(((Trait) value).asDeclarations(param, expanded));
            }
        });
        return expanded;
    }

    private static <V> V inherit(V own, V inherited, V fallback) {
        if (own != null) {
            return own;
        }
        return inherited != null ? inherited : fallback;
    }

    @Override
    public String toString() {
        return "FactoryOptions(" + name + ")";
    }
}
