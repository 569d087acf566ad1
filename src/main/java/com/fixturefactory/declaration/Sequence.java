package com.fixturefactory.declaration;

import java.util.Map;
import java.util.Objects;
import java.util.function.IntFunction;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

/**
 * Value computed from the sequence counter of the current generate call.
 */
public class Sequence extends Declaration {

    private final IntFunction<?> function;

    public Sequence(IntFunction<?> function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.SEQUENCE;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        return function.apply(step.getSequence());
    }
}
