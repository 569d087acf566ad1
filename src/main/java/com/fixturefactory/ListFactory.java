package com.fixturefactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.fixturefactory.exception.ModelInstantiationException;
import com.fixturefactory.options.ModelReference;

/**
 * Builds an {@link ArrayList} from overrides keyed {@code "0"}, {@code "1"}, ...;
 * backs {@link com.fixturefactory.declaration.ListDeclaration}.
 */
public final class ListFactory {

    public static final Factory<List<Object>> INSTANCE =
            new FactoryDefinition<List<Object>>(null, ModelReference.of(ArrayList.class))
                    .named("ListFactory")
                    .instantiatedWith((model, arguments) -> toList(arguments.getKwargs()))
                    .notStubbable()
                    .build();

    private ListFactory() {
    }

    private static List<Object> toList(Map<String, Object> indexed) {
        List<Object> result = new ArrayList<>(indexed.size());
        indexed.entrySet().stream()
                .sorted(Comparator.comparingInt(entry -> index(entry.getKey())))
                .forEach(entry -> result.add(entry.getValue()));
        return result;
    }

    private static int index(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            throw new ModelInstantiationException("List element key '" + key + "' is not an index", e);
        }
    }
}
