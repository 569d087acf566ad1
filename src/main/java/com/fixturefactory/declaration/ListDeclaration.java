package com.fixturefactory.declaration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fixturefactory.Factory;
import com.fixturefactory.ListFactory;
import com.fixturefactory.util.LazyReference;

/**
 * A list whose elements are themselves declarations; element {@code i} can be overridden
 * with {@code field__i}. Shares the enclosing sequence value.
 */
public class ListDeclaration extends SubFactory {

    public ListDeclaration(List<?> params) {
        super(LazyReference.<Factory<?>>ofValue(ListFactory.INSTANCE), indexed(params));
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.LIST;
    }

    @Override
    protected boolean isSequenceForced() {
        return true;
    }

    private static Map<String, Object> indexed(List<?> params) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            result.put(String.valueOf(i), params.get(i));
        }
        return result;
    }
}
