package com.fixturefactory.declaration;

import java.util.Objects;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;

/**
 * Runs a {@link PostGenerationHook} against the generated object.
 */
public class PostGeneration extends PostGenerationDeclaration {

    private final PostGenerationHook hook;

    public PostGeneration(PostGenerationHook hook) {
        this.hook = Objects.requireNonNull(hook, "hook");
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.POST_GENERATION;
    }

    @Override
    public Object call(Object instance, BuildStep step, PostGenerationContext context) {
        hook.call(instance, step.isCreate(), context.getValue(), context.getExtra());
        return null;
    }
}
