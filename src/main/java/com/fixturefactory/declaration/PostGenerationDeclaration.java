package com.fixturefactory.declaration;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;

/**
 * Base of the declarations applied after the object has been instantiated.
 */
public abstract class PostGenerationDeclaration extends Declaration {

    @Override
    public final BuilderPhase getPhase() {
        return BuilderPhase.POST_INSTANTIATION;
    }

    @Override
    public abstract Object call(Object instance, BuildStep step, PostGenerationContext context);
}
