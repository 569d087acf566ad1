package com.fixturefactory.declaration;

import java.util.Map;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A literal value.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class StaticValue extends Declaration {

    private final Object value;

    public StaticValue(Object value) {
        this.value = value;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.STATIC_VALUE;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        return value;
    }
}
