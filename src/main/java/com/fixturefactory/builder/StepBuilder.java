package com.fixturefactory.builder;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.FactoryRuntime;
import com.fixturefactory.exception.InvalidDeclarationException;
import com.fixturefactory.options.FactoryOptions;
import com.fixturefactory.strategy.Arguments;
import com.fixturefactory.strategy.Strategy;

/**
 * Drives one generate call: merge overrides, resolve attributes, instantiate, then apply
 * post-generation declarations in declaration order.
 * <p>
 * STUB never loads the model class; post-generation declarations then receive the
 * {@link com.fixturefactory.strategy.StubObject}. Any failure aborts the whole call; nothing is
 * returned half-built.
 */
public final class StepBuilder {
    private static final Logger log = LoggerFactory.getLogger(StepBuilder.class);

    /** Override forcing the sequence value of this call without touching the counter. */
    public static final String FORCE_SEQUENCE_KEY = "__sequence";

    private final FactoryOptions options;
    private final Map<String, Object> extras;
    private final Strategy strategy;
    private final FactoryRuntime runtime;
    private final Integer forcedInitSequence;

    public StepBuilder(FactoryOptions options, Map<String, Object> extras, Strategy strategy, FactoryRuntime runtime) {
        this.options = options;
        this.extras = new LinkedHashMap<>(extras);
        this.strategy = strategy;
        this.runtime = runtime;
        this.forcedInitSequence = toSequence(this.extras.remove(FORCE_SEQUENCE_KEY));
    }

    /**
     * @param parentStep    step of the enclosing factory, {@code null} for a top-level call
     * @param forceSequence sequence value imposed by the caller, {@code null} to use the counter
     */
    public Object build(BuildStep parentStep, Integer forceSequence) {
        if (strategy != Strategy.STUB) {
            options.ensureConcrete();
        }

        ParsedDeclarations declarations = DeclarationSet.parse(
                extras, options.getPreDeclarations(), options.getPostDeclarations());

        BuildStep step = new BuildStep(this, pickSequence(forceSequence), parentStep);
        log.debug("{}: {} (depth={}, overrides={})", step, strategy, depth(parentStep), extras.keySet());
        step.resolve(declarations.getPre());

        Arguments arguments = options.prepareArguments(step.getAttributes());
        Object instance = options.instantiate(strategy, arguments);

        Map<String, Object> results = new LinkedHashMap<>();
        DeclarationSet post = declarations.getPost();
        for (String name : post.names()) {
            DeclarationWithContext entry = post.get(name);
            Map<String, Object> unrolled = step.unrollContext(entry.getDeclaration(), entry.getContext());
            log.debug("{}: post-generation {}", step, name);
            results.put(name, entry.getDeclaration().call(instance, step, PostGenerationContext.from(unrolled)));
        }
        options.afterPostGeneration(instance, strategy == Strategy.CREATE, results);
        return instance;
    }

    /**
     * Resolves the pre-instantiation attributes only; used to evaluate nested contexts.
     */
    Map<String, Object> resolveAttributes(BuildStep parentStep, Integer forceSequence) {
        ParsedDeclarations declarations = DeclarationSet.parse(
                extras, options.getPreDeclarations(), options.getPostDeclarations());
        BuildStep step = new BuildStep(this, pickSequence(forceSequence), parentStep);
        step.resolve(declarations.getPre());
        return new LinkedHashMap<>(step.getAttributes());
    }

    StepBuilder recurse(FactoryOptions nestedOptions, Map<String, Object> nestedExtras, Strategy nestedStrategy) {
        return new StepBuilder(nestedOptions, nestedExtras, nestedStrategy, runtime);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public FactoryRuntime getRuntime() {
        return runtime;
    }

    public FactoryOptions getOptions() {
        return options;
    }

    private int pickSequence(Integer forceSequence) {
        if (forceSequence != null) {
            return forceSequence;
        }
        if (forcedInitSequence != null) {
            return forcedInitSequence;
        }
        return runtime.getSequences().next(options.getCounterReference());
    }

    private static Integer toSequence(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new InvalidDeclarationException(FORCE_SEQUENCE_KEY + " must be a number, got " + value);
        }
        return ((Number) value).intValue();
    }

    private static int depth(BuildStep step) {
        int depth = 0;
        for (BuildStep current = step; current != null; current = current.getParentStep()) {
            depth++;
        }
        return depth;
    }
}
