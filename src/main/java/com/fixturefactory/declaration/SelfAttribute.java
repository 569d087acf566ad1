package com.fixturefactory.declaration;

import java.util.List;
import java.util.Map;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;
import com.fixturefactory.exception.FactoryConfigurationException;
import com.fixturefactory.util.AttributeAccess;

import lombok.Getter;

/**
 * Copies another attribute by dotted path.
 * <p>
 * {@code "a.b"} reads {@code b} from the value of sibling {@code a}. Every leading dot beyond the
 * first climbs one enclosing factory: {@code "..x"} reads {@code x} from the parent,
 * {@code "...x"} from the grandparent.
 */
@Getter
public class SelfAttribute extends Declaration {

    private static final Object NO_DEFAULT = new Object();

    private final String rawPath;
    private final int depth;
    private final String attributePath;
    private final Object defaultValue;

    public SelfAttribute(String path) {
        this(path, NO_DEFAULT);
    }

    public SelfAttribute(String path, Object defaultValue) {
        this.rawPath = path;
        int dots = 0;
        while (dots < path.length() && path.charAt(dots) == '.') {
            dots++;
        }
        this.depth = dots;
        this.attributePath = path.substring(dots);
        this.defaultValue = defaultValue;
        if (attributePath.isEmpty()) {
            throw new FactoryConfigurationException("SelfAttribute path '" + path + "' names no attribute");
        }
    }

    public boolean hasDefault() {
        return defaultValue != NO_DEFAULT;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.SELF_ATTRIBUTE;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        Resolver target = resolver;
        if (depth > 1) {
            List<Resolver> chain = step.getChain();
            if (depth - 1 >= chain.size()) {
                throw new FactoryConfigurationException(String.format(
                        "SelfAttribute('%s') climbs %d level(s) but only %d enclosing factory(ies) exist",
                        rawPath, depth - 1, chain.size() - 1));
            }
            target = chain.get(depth - 1);
        }
        if (hasDefault()) {
            return AttributeAccess.getPath(target, attributePath, defaultValue);
        }
        return AttributeAccess.getPath(target, attributePath);
    }

    @Override
    public String toString() {
        return "SelfAttribute(" + rawPath + ")";
    }
}
