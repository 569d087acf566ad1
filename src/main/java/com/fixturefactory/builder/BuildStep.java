package com.fixturefactory.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fixturefactory.DictFactory;
import com.fixturefactory.FactoryRuntime;
import com.fixturefactory.declaration.Declaration;
import com.fixturefactory.declaration.Maybe;
import com.fixturefactory.options.FactoryOptions;
import com.fixturefactory.strategy.Strategy;

/**
 * State of one object being generated: its sequence value, its resolver and the step of the
 * enclosing factory, if any.
 */
public final class BuildStep {

    private final StepBuilder builder;
    private final int sequence;
    private final BuildStep parentStep;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Resolver resolver;

    BuildStep(StepBuilder builder, int sequence, BuildStep parentStep) {
        this.builder = builder;
        this.sequence = sequence;
        this.parentStep = parentStep;
    }

    void resolve(DeclarationSet declarations) {
        resolver = new Resolver(declarations, this);
        for (String name : declarations.names()) {
            attributes.put(name, resolver.get(name));
        }
    }

    /**
     * This step's resolver followed by those of the enclosing steps, nearest first.
     */
    public List<Resolver> getChain() {
        List<Resolver> chain = new ArrayList<>();
        for (BuildStep current = this; current != null; current = current.parentStep) {
            chain.add(current.resolver);
        }
        return chain;
    }

    /**
     * Generates a nested object with the same strategy, this step becoming its parent.
     *
     * @param forceSequence sequence value to reuse, {@code null} to advance the nested factory's own counter
     */
    public Object recurse(FactoryOptions options, Map<String, Object> extras, Integer forceSequence) {
        return recurse(options, extras, forceSequence, builder.getStrategy());
    }

    public Object recurse(FactoryOptions options, Map<String, Object> extras, Integer forceSequence, Strategy strategy) {
        return builder.recurse(options, extras, strategy).build(this, forceSequence);
    }

    /**
     * Merges a declaration's defaults with its call-time context and, when the declaration asks
     * for it, resolves declarations found among them in a scope of their own.
     */
    public Map<String, Object> unrollContext(Declaration declaration, Map<String, Object> context) {
        Map<String, Object> full = new LinkedHashMap<>(declaration.getDefaults());
        context.forEach((key, value) -> full.put(key, inheritFallback(value, full.get(key))));
        if (!declaration.isContextUnrolled()) {
            return full;
        }
        if (full.values().stream().noneMatch(value -> value instanceof Declaration)) {
            return full;
        }
        return builder.recurse(DictFactory.INSTANCE.getOptions(), full, builder.getStrategy())
                .resolveAttributes(this, sequence);
    }

    /**
     * A trait override reaching into this context falls back on the declared default it replaces.
     */
    private static Object inheritFallback(Object override, Object declaredDefault) {
        if (declaredDefault != null && override instanceof Maybe && ((Maybe) override).isFallbackInherited()) {
            return ((Maybe) override).withFallback(Declaration.wrap(declaredDefault));
        }
        return override;
    }

    public int getSequence() {
        return sequence;
    }

    public BuildStep getParentStep() {
        return parentStep;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public Strategy getStrategy() {
        return builder.getStrategy();
    }

    /**
     * Whether the object is being persisted; false for BUILD and STUB.
     */
    public boolean isCreate() {
        return builder.getStrategy() == Strategy.CREATE;
    }

    public FactoryRuntime getRuntime() {
        return builder.getRuntime();
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return builder.getOptions().getName() + "#" + sequence;
    }
}
