package com.fixturefactory.declaration;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

import lombok.Value;

/**
 * Applies a transformation to the default value and to raw call-time overrides alike.
 * Wrap an override in {@link #force(Object)} to store it untransformed.
 */
public class Transformer extends Declaration {

    private final Function<Object, ?> transform;
    private final Object defaultValue;

    public Transformer(Function<Object, ?> transform, Object defaultValue) {
        this.transform = Objects.requireNonNull(transform, "transform");
        this.defaultValue = defaultValue;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.TRANSFORMER;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        Object value = defaultValue;
        if (defaultValue instanceof Declaration) {
            Declaration declaration = (Declaration) defaultValue;
            value = declaration.evaluate(resolver, step, step.unrollContext(declaration, context));
        }
        return transform.apply(value);
    }

    /**
     * Transforms a raw call-time override; forced values are unwrapped as-is.
     */
    public Object transformOverride(Object override) {
        if (override instanceof Force) {
            return ((Force) override).getValue();
        }
        return transform.apply(override);
    }

    public static Force force(Object value) {
        return new Force(value);
    }

    /**
     * An override that bypasses the transformation.
     */
    @Value
    public static class Force {
        Object value;
    }
}
