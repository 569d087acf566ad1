package com.fixturefactory.declaration;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

/**
 * Value computed by a supplier that needs no context, called once per generate call.
 */
public class LazyFunction extends Declaration {

    private final Supplier<?> function;

    public LazyFunction(Supplier<?> function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.LAZY_FUNCTION;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        return function.get();
    }
}
