package com.fixturefactory.declaration;

import java.util.Map;

import com.fixturefactory.DictFactory;
import com.fixturefactory.Factory;
import com.fixturefactory.util.LazyReference;

/**
 * A map whose values are themselves declarations, resolved in their own scope.
 * Use {@code ..name} to reach the enclosing factory's attributes. Shares the enclosing sequence value.
 */
public class Dict extends SubFactory {

    public Dict(Map<String, Object> params) {
        super(LazyReference.<Factory<?>>ofValue(DictFactory.INSTANCE), params);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.DICT;
    }

    @Override
    protected boolean isSequenceForced() {
        return true;
    }
}
