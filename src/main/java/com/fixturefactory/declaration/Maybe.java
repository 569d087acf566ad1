package com.fixturefactory.declaration;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;
import com.fixturefactory.builder.Resolver;
import com.fixturefactory.exception.InvalidDeclarationException;

/**
 * Picks one of two declarations depending on a decider.
 * <p>
 * The decider is either the name of a sibling attribute or a declaration; only the chosen
 * branch is evaluated. Both branches must belong to the same phase ({@link Skip#SKIP} fits
 * either one).
 */
public class Maybe extends Declaration {

    /**
     * Fallback that defers to whatever declaration this Maybe replaces, or {@link Skip#SKIP}
     * when it replaces nothing.
     */
    static final StaticValue INHERITED = new StaticValue(Skip.SKIP);

    private final Declaration decider;
    private final Declaration yesDeclaration;
    private final Declaration noDeclaration;
    private final BuilderPhase phase;

    public Maybe(Object decider, Object yesDeclaration, Object noDeclaration) {
        this.decider = decider instanceof String
                ? new SelfAttribute((String) decider, null)
                : Declaration.wrap(decider);
        this.yesDeclaration = Declaration.wrap(yesDeclaration);
        this.noDeclaration = Declaration.wrap(noDeclaration);
        if (this.decider.isPostGeneration()) {
            throw new InvalidDeclarationException("Maybe decider " + decider + " must be resolvable before instantiation");
        }
        this.phase = commonPhase(this.yesDeclaration, this.noDeclaration);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.MAYBE;
    }

    @Override
    public BuilderPhase getPhase() {
        return phase;
    }

    @Override
    public boolean isContextUnrolled() {
        return false;
    }

    public boolean isFallbackInherited() {
        return noDeclaration == INHERITED;
    }

    /**
     * Copy of this Maybe whose no-branch is {@code fallback}.
     */
    public Maybe withFallback(Declaration fallback) {
        return new Maybe(decider, yesDeclaration, fallback);
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        Declaration chosen = choose(resolver, step);
        return chosen.evaluate(resolver, step, step.unrollContext(chosen, context));
    }

    @Override
    public Object call(Object instance, BuildStep step, PostGenerationContext context) {
        Declaration chosen = choose(step.getResolver(), step);
        if (!chosen.isPostGeneration()) {
            return null;
        }
        return chosen.call(instance, step, context);
    }

    private Declaration choose(Resolver resolver, BuildStep step) {
        Object decision = decider.evaluate(resolver, step, Map.of());
        return isTruthy(decision) ? yesDeclaration : noDeclaration;
    }

    /**
     * {@code null}, {@code false}, zero, empty strings, empty collections and maps, empty
     * optionals and {@link Skip#SKIP} are false; everything else is true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null || value == Skip.SKIP) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0d;
        if (value instanceof CharSequence) return ((CharSequence) value).length() > 0;
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        if (value instanceof Optional) return ((Optional<?>) value).isPresent();
        return true;
    }

    private static BuilderPhase commonPhase(Declaration yes, Declaration no) {
        boolean yesNeutral = isSkip(yes);
        boolean noNeutral = isSkip(no);
        if (yesNeutral && noNeutral) {
            return BuilderPhase.ATTRIBUTE_RESOLUTION;
        }
        if (yesNeutral) {
            return no.getPhase();
        }
        if (noNeutral || yes.getPhase() == no.getPhase()) {
            return yes.getPhase();
        }
        throw new InvalidDeclarationException(String.format(
                "Inconsistent phases for Maybe: yes=%s (%s), no=%s (%s)",
                yes.getKind(), yes.getPhase(), no.getKind(), no.getPhase()));
    }

    private static boolean isSkip(Declaration declaration) {
        return declaration instanceof StaticValue && ((StaticValue) declaration).getValue() == Skip.SKIP;
    }
}
