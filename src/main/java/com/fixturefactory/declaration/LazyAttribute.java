package com.fixturefactory.declaration;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

/**
 * Value computed from the other attributes of the object being built.
 * The function reads siblings through {@link Resolver#get(String)} and the enclosing factory
 * through {@link Resolver#getFactoryParent()}.
 */
public class LazyAttribute extends Declaration {

    private final Function<Resolver, ?> function;

    public LazyAttribute(Function<Resolver, ?> function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.LAZY_ATTRIBUTE;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        return function.apply(resolver);
    }
}
