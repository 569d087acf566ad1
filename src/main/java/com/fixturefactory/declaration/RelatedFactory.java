package com.fixturefactory.declaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.Factory;
import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;
import com.fixturefactory.strategy.Strategy;
import com.fixturefactory.util.LazyReference;

/**
 * Generates a related object once the primary one exists, passing the primary object as
 * {@code relatedName}.
 * <p>
 * If a value is passed at call time under this declaration's own name, nothing is generated:
 * that value is used as-is and {@code name__key} overrides are ignored.
 */
public class RelatedFactory extends PostGenerationDeclaration {
    private static final Logger log = LoggerFactory.getLogger(RelatedFactory.class);

    private final LazyReference<Factory<?>> factory;
    private final String relatedName;
    private final Map<String, Object> defaults;
    private final Strategy strategy;

    public RelatedFactory(Factory<?> factory, String relatedName, Map<String, Object> defaults) {
        this(LazyReference.<Factory<?>>ofValue(factory), relatedName, defaults, null);
    }

    public RelatedFactory(Supplier<? extends Factory<?>> factory, String relatedName, Map<String, Object> defaults) {
        this(LazyReference.<Factory<?>>of(factory, "related factory"), relatedName, defaults, null);
    }

    /**
     * @param strategy strategy of the related call, {@code null} to follow the primary object
     */
    public RelatedFactory(LazyReference<Factory<?>> factory, String relatedName, Map<String, Object> defaults, Strategy strategy) {
        this.factory = factory;
        this.relatedName = relatedName == null ? "" : relatedName;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        this.strategy = strategy;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.RELATED_FACTORY;
    }

    @Override
    public boolean isContextUnrolled() {
        return false;
    }

    public Factory<?> getFactory() {
        return factory.get();
    }

    @Override
    public Object call(Object instance, BuildStep step, PostGenerationContext context) {
        if (context.isValueProvided()) {
            log.debug("RelatedFactory {}: using provided value, skipping generation", getFactory().getName());
            return context.getValue();
        }
        return generateOne(instance, step, context);
    }

    protected Object generateOne(Object instance, BuildStep step, PostGenerationContext context) {
        Map<String, Object> passed = new LinkedHashMap<>(defaults);
        passed.putAll(context.getExtra());
        if (!relatedName.isEmpty()) {
            passed.put(relatedName, instance);
        }
        Strategy relatedStrategy = strategy != null ? strategy : step.getStrategy();
        return step.recurse(getFactory().getOptions(), passed, null, relatedStrategy);
    }
}
