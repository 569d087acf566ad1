package com.fixturefactory.declaration;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

/**
 * A {@link LazyAttribute} that also receives the sequence value.
 */
public class LazyAttributeSequence extends Declaration {

    private final BiFunction<Resolver, Integer, ?> function;

    public LazyAttributeSequence(BiFunction<Resolver, Integer, ?> function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.LAZY_ATTRIBUTE_SEQUENCE;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        return function.apply(resolver, step.getSequence());
    }
}
