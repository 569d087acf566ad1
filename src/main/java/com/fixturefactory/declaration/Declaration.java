package com.fixturefactory.declaration;

import java.util.Map;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;
import com.fixturefactory.builder.Resolver;

/**
 * A named, reusable rule describing how to compute one attribute.
 * <p>
 * Declarations are immutable and shared by every generate call of the factories that declare
 * or inherit them; each evaluation produces a fresh value. {@link IteratorDeclaration} is the
 * one variant with state, and that state is deliberately shared.
 */
public abstract class Declaration {

    public abstract DeclarationKind getKind();

    public BuilderPhase getPhase() {
        return BuilderPhase.ATTRIBUTE_RESOLUTION;
    }

    public boolean isPostGeneration() {
        return getPhase() == BuilderPhase.POST_INSTANTIATION;
    }

    /**
     * Declared nested values, merged under the call-time context.
     */
    public Map<String, Object> getDefaults() {
        return Map.of();
    }

    /**
     * Whether declarations found in the nested context are resolved before this declaration sees them.
     * Sub-factories pass them through untouched so the nested factory resolves them itself.
     */
    public boolean isContextUnrolled() {
        return true;
    }

    /**
     * Computes the value of a pre-instantiation declaration.
     *
     * @param resolver sibling attributes of the object being built
     * @param step     the running build step (sequence value, strategy, parent chain)
     * @param context  nested overrides routed to this declaration, defaults included
     */
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        throw new UnsupportedOperationException(getKind() + " cannot be evaluated before instantiation");
    }

    /**
     * Applies a post-instantiation declaration to the freshly built object.
     *
     * @return a result handed to the factory's after-post-generation hook
     */
    public Object call(Object instance, BuildStep step, PostGenerationContext context) {
        throw new UnsupportedOperationException(getKind() + " cannot be applied after instantiation");
    }

    /**
     * Wraps raw values in a {@link StaticValue}; declarations are returned as-is.
     */
    public static Declaration wrap(Object value) {
        if (value instanceof Declaration) {
            return (Declaration) value;
        }
        return new StaticValue(value);
    }
}
