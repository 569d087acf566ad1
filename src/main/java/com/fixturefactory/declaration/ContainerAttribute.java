package com.fixturefactory.declaration;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;
import com.fixturefactory.exception.FactoryConfigurationException;

/**
 * Like {@link LazyAttribute}, also receiving the resolvers of the enclosing factories,
 * nearest first.
 */
public class ContainerAttribute extends Declaration {

    private final BiFunction<Resolver, List<Resolver>, ?> function;
    private final boolean strict;

    /**
     * @param strict fail when used outside of a sub-factory (no containers)
     */
    public ContainerAttribute(BiFunction<Resolver, List<Resolver>, ?> function, boolean strict) {
        this.function = Objects.requireNonNull(function, "function");
        this.strict = strict;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.CONTAINER_ATTRIBUTE;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        List<Resolver> chain = step.getChain();
        List<Resolver> containers = chain.subList(1, chain.size());
        if (strict && containers.isEmpty()) {
            throw new FactoryConfigurationException("A strict ContainerAttribute can only be used within a SubFactory");
        }
        return function.apply(resolver, containers);
    }
}
