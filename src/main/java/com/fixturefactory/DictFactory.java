package com.fixturefactory;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fixturefactory.options.ModelReference;

/**
 * Builds a {@link LinkedHashMap} from its overrides; backs {@link com.fixturefactory.declaration.Dict}.
 */
public final class DictFactory {

    public static final Factory<Map<String, Object>> INSTANCE =
            new FactoryDefinition<Map<String, Object>>(null, ModelReference.of(LinkedHashMap.class))
                    .named("DictFactory")
                    .notStubbable()
                    .build();

    private DictFactory() {
    }
}
