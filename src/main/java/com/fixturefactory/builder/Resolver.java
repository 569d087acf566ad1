package com.fixturefactory.builder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.fixturefactory.declaration.Declaration;
import com.fixturefactory.exception.CyclicDefinitionException;
import com.fixturefactory.exception.UnknownAttributeException;
import com.fixturefactory.random.RandomState;
import com.fixturefactory.util.AttributeSource;

/**
 * Resolves the pre-instantiation declarations of one build step.
 * <p>
 * Values are computed on first access and cached, so every attribute is evaluated at most once
 * per generate call whatever the order in which siblings reference each other. A reference
 * back to an attribute still being computed raises {@link CyclicDefinitionException}.
 */
public final class Resolver implements AttributeSource {

    private final DeclarationSet declarations;
    private final BuildStep step;

    private final Map<String, Object> values = new HashMap<>();
    private final Set<String> pending = new LinkedHashSet<>();

    Resolver(DeclarationSet declarations, BuildStep step) {
        this.declarations = declarations;
        this.step = step;
    }

    /**
     * Value of attribute {@code name}, computing it if needed.
     *
     * @throws UnknownAttributeException  if nothing declares {@code name}
     * @throws CyclicDefinitionException if {@code name} depends on itself
     */
    public Object get(String name) {
        if (pending.contains(name)) {
            throw new CyclicDefinitionException(name, new ArrayList<>(pending));
        }
        if (values.containsKey(name)) {
            return values.get(name);
        }
        DeclarationWithContext entry = declarations.get(name);
        if (entry == null) {
            throw new UnknownAttributeException(name, String.format(
                    "The parameter '%s' is unknown. Evaluated attributes are %s, definitions are %s",
                    name, values, declarations.names()));
        }

        Declaration declaration = entry.getDeclaration();
        pending.add(name);
        Object value;
        try {
            Map<String, Object> context = step.unrollContext(declaration, entry.getContext());
            value = declaration.evaluate(this, step, context);
        } finally {
            pending.remove(name);
        }
        values.put(name, value);
        return value;
    }

    public <V> V get(String name, Class<V> type) {
        return type.cast(get(name));
    }

    public boolean isDeclared(String name) {
        return declarations.contains(name);
    }

    public Set<String> getNames() {
        return declarations.names();
    }

    /**
     * Resolver of the factory whose sub-factory is being built, {@code null} at the top level.
     */
    public Resolver getFactoryParent() {
        BuildStep parent = step.getParentStep();
        return parent != null ? parent.getResolver() : null;
    }

    public int getSequence() {
        return step.getSequence();
    }

    public RandomState getRandom() {
        return step.getRuntime().getRandom();
    }

    @Override
    public Object getAttribute(String name) {
        return get(name);
    }

    @Override
    public String toString() {
        return "Resolver for " + step;
    }
}
