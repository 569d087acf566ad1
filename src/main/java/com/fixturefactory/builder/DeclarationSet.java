package com.fixturefactory.builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fixturefactory.declaration.Declaration;
import com.fixturefactory.declaration.Maybe;
import com.fixturefactory.declaration.Transformer;
import com.fixturefactory.exception.InvalidDeclarationException;

/**
 * Ordered declarations of one phase, plus the nested overrides routed to each of them.
 * <p>
 * {@code owner__name} is stored as context {@code name} of declaration {@code owner}.
 * Replacing a declaration keeps its original position, so iteration follows the order in
 * which names were first declared, parents before children.
 */
public final class DeclarationSet {

    public static final String SPLITTER = "__";

    private final LinkedHashMap<String, Declaration> declarations = new LinkedHashMap<>();
    private final Map<String, LinkedHashMap<String, Object>> contexts = new LinkedHashMap<>();

    public DeclarationSet() {
    }

    public DeclarationSet(Map<String, Object> initial) {
        update(initial);
    }

    /**
     * {@code "a__b__c"} gives {@code ["a", "b__c"]}; {@code "a"} gives {@code ["a", null]}.
     */
    public static String[] split(String entry) {
        int index = entry.indexOf(SPLITTER);
        if (index < 0) {
            return new String[]{entry, null};
        }
        return new String[]{entry.substring(0, index), entry.substring(index + SPLITTER.length())};
    }

    public static String join(String root, String subKey) {
        return subKey == null ? root : root + SPLITTER + subKey;
    }

    public DeclarationSet copy() {
        DeclarationSet copy = new DeclarationSet();
        copy.declarations.putAll(declarations);
        contexts.forEach((root, context) -> copy.contexts.put(root, new LinkedHashMap<>(context)));
        return copy;
    }

    /**
     * Adds or replaces declarations. Raw values are wrapped; nested keys go to the context
     * of their root.
     *
     * @throws InvalidDeclarationException if nested keys target an undeclared root
     */
    public void update(Map<String, Object> values) {
        values.forEach((key, value) -> {
            String[] parts = split(key);
            String root = parts[0];
            if (parts[1] == null) {
                declarations.put(root, withFallback(root, Declaration.wrap(value)));
            } else {
                contexts.computeIfAbsent(root, r -> new LinkedHashMap<>()).put(parts[1], value);
            }
        });

        List<String> unknown = new ArrayList<>();
        contexts.forEach((root, context) -> {
            if (!declarations.containsKey(root)) {
                context.keySet().forEach(sub -> unknown.add(join(root, sub)));
            }
        });
        if (!unknown.isEmpty()) {
            throw new InvalidDeclarationException(String.format(
                    "Received deep context for unknown fields: %s (known=%s)", unknown, declarations.keySet()));
        }
    }

    /**
     * Entries whose root is declared here: overrides of a declaration or parameters for one.
     */
    public List<String> filter(Collection<String> entries) {
        List<String> result = new ArrayList<>();
        for (String entry : entries) {
            if (declarations.containsKey(split(entry)[0])) {
                result.add(entry);
            }
        }
        return result;
    }

    public boolean contains(String name) {
        return declarations.containsKey(name);
    }

    public DeclarationWithContext get(String name) {
        Declaration declaration = declarations.get(name);
        if (declaration == null) {
            return null;
        }
        Map<String, Object> context = contexts.getOrDefault(name, new LinkedHashMap<>());
        return new DeclarationWithContext(name, declaration, Collections.unmodifiableMap(context));
    }

    public Declaration getDeclaration(String name) {
        return declarations.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(declarations.keySet());
    }

    /**
     * Flattened form suitable for {@link #DeclarationSet(Map)}.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        declarations.forEach((name, declaration) -> {
            result.put(name, declaration);
            contexts.getOrDefault(name, new LinkedHashMap<>())
                    .forEach((sub, value) -> result.put(join(name, sub), value));
        });
        return result;
    }

    /**
     * Splits call-time overrides between pre- and post-instantiation declarations.
     * <p>
     * Post-generation declarations go to the post set; a raw value given for a post declaration
     * becomes its extracted value ({@code name__}); keys whose root is a post declaration are
     * routed there; everything else lands in the pre set. Raw overrides of a {@link Transformer}
     * are transformed here.
     */
    public static ParsedDeclarations parse(Map<String, Object> overrides, DeclarationSet basePre, DeclarationSet basePost) {
        DeclarationSet pre = basePre != null ? basePre.copy() : new DeclarationSet();
        DeclarationSet post = basePost != null ? basePost.copy() : new DeclarationSet();

        Map<String, Object> extraPost = new LinkedHashMap<>();
        Map<String, Object> extraMaybeNonPost = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        overrides.forEach((key, value) -> {
            if (value instanceof Declaration && ((Declaration) value).isPostGeneration()) {
                if (pre.contains(key)) {
                    errors.add(String.format("Post-generation declaration %s=%s shadows declaration %s",
                            key, value, pre.getDeclaration(key)));
                    return;
                }
                extraPost.put(key, value);
            } else if (post.contains(key)) {
                extraPost.put(join(key, ""), value);
            } else if (pre.getDeclaration(key) instanceof Transformer && !(value instanceof Declaration)) {
                extraMaybeNonPost.put(key, ((Transformer) pre.getDeclaration(key)).transformOverride(value));
            } else {
                extraMaybeNonPost.put(key, value instanceof Transformer.Force ? ((Transformer.Force) value).getValue() : value);
            }
        });
        if (!errors.isEmpty()) {
            throw new InvalidDeclarationException(errors);
        }

        post.update(extraPost);

        List<String> postOverrides = post.filter(extraMaybeNonPost.keySet());
        Map<String, Object> postContext = new LinkedHashMap<>();
        Map<String, Object> preValues = new LinkedHashMap<>();
        extraMaybeNonPost.forEach((key, value) -> {
            if (postOverrides.contains(key)) {
                postContext.put(key, value);
            } else {
                preValues.put(key, value);
            }
        });
        post.update(postContext);
        pre.update(preValues);

        return new ParsedDeclarations(pre, post);
    }

    private Declaration withFallback(String root, Declaration incoming) {
        if (incoming instanceof Maybe && ((Maybe) incoming).isFallbackInherited() && declarations.containsKey(root)) {
            return ((Maybe) incoming).withFallback(declarations.get(root));
        }
        return incoming;
    }

    @Override
    public String toString() {
        return "DeclarationSet" + asMap();
    }
}
