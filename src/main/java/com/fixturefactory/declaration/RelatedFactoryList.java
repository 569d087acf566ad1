package com.fixturefactory.declaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;

import com.fixturefactory.Factory;
import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;
import com.fixturefactory.util.LazyReference;

/**
 * {@link RelatedFactory} run {@code size} times; the size supplier is consulted on every call.
 */
public class RelatedFactoryList extends RelatedFactory {

    private final IntSupplier size;

    public RelatedFactoryList(Factory<?> factory, String relatedName, IntSupplier size, Map<String, Object> defaults) {
        super(LazyReference.<Factory<?>>ofValue(factory), relatedName, defaults, null);
        this.size = size;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.RELATED_FACTORY_LIST;
    }

    @Override
    public Object call(Object instance, BuildStep step, PostGenerationContext context) {
        if (context.isValueProvided()) {
            return context.getValue();
        }
        int count = size.getAsInt();
        List<Object> related = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            related.add(generateOne(instance, step, context));
        }
        return related;
    }
}
