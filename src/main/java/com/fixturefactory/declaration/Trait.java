package com.fixturefactory.declaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;
import com.fixturefactory.exception.InvalidDeclarationException;

/**
 * A bundle of overrides switched on by a boolean parameter named after the trait.
 * <p>
 * Never evaluated itself: when the factory options are assembled, each overridden field
 * becomes a {@link Maybe} deciding on the trait flag, falling back to the previous
 * declaration of that field. A raw value for a post-generation field overrides its extracted
 * value, as the same value passed at call time would. Traits may switch on other traits.
 */
public class Trait extends Declaration {

    private static final String SPLITTER = "__";

    private final Map<String, Object> overrides;

    public Trait(Map<String, Object> overrides) {
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public Map<String, Object> getOverrides() {
        return overrides;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.TRAIT;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        throw new InvalidDeclarationException("A Trait is only meaningful as a factory parameter");
    }

    /**
     * @param traitName    parameter that switches this trait on
     * @param declarations declarations assembled so far, used as fallbacks
     * @return the replacement declarations for every overridden field
     */
    public Map<String, Object> asDeclarations(String traitName, Map<String, Object> declarations) {
        Map<String, Object> result = new LinkedHashMap<>();
        overrides.forEach((name, value) -> {
            String field = extractedValueKey(name, value, declarations);
            int nesting = countSplitters(field);
            String deciderPath = nesting == 0 ? traitName : ".".repeat(nesting + 1) + traitName;
            Object fallback = declarations.containsKey(field) ? declarations.get(field) : Maybe.INHERITED;
            result.put(field, new Maybe(new SelfAttribute(deciderPath, false), value, fallback));
        });
        return result;
    }

    /**
     * A raw value for a post-generation field is that field's extracted value, stored under
     * {@code name__}.
     */
    private static String extractedValueKey(String field, Object value, Map<String, Object> declarations) {
        Object declared = declarations.get(field);
        if (declared instanceof Declaration && ((Declaration) declared).isPostGeneration()
                && !(value instanceof Declaration)) {
            return field + SPLITTER;
        }
        return field;
    }

    private static int countSplitters(String field) {
        int count = 0;
        int index = field.indexOf(SPLITTER);
        while (index >= 0) {
            count++;
            index = field.indexOf(SPLITTER, index + SPLITTER.length());
        }
        return count;
    }
}
