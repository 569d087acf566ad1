package com.fixturefactory.declaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.fixturefactory.Factory;
import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;
import com.fixturefactory.util.LazyReference;

/**
 * Builds a nested object with another factory, using the strategy of the enclosing call.
 * <p>
 * Nested overrides are merged as: the nested factory's declarations, then the defaults given
 * here, then call-time {@code field__sub} overrides. The enclosing resolver becomes the
 * nested call's parent.
 */
public class SubFactory extends Declaration {

    private final LazyReference<Factory<?>> factory;
    private final Map<String, Object> defaults;

    public SubFactory(Factory<?> factory, Map<String, Object> defaults) {
        this(LazyReference.<Factory<?>>ofValue(factory), defaults);
    }

    public SubFactory(Supplier<? extends Factory<?>> factory, Map<String, Object> defaults) {
        this(LazyReference.<Factory<?>>of(factory, "sub-factory"), defaults);
    }

    protected SubFactory(LazyReference<Factory<?>> factory, Map<String, Object> defaults) {
        this.factory = factory;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public Factory<?> getFactory() {
        return factory.get();
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.SUB_FACTORY;
    }

    @Override
    public Map<String, Object> getDefaults() {
        return defaults;
    }

    @Override
    public boolean isContextUnrolled() {
        return false;
    }

    /**
     * Whether the nested call reuses the enclosing sequence value instead of advancing its own counter.
     */
    protected boolean isSequenceForced() {
        return false;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        Integer forcedSequence = isSequenceForced() ? step.getSequence() : null;
        return step.recurse(getFactory().getOptions(), context, forcedSequence);
    }
}
