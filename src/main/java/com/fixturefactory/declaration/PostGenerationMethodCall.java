package com.fixturefactory.declaration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.PostGenerationContext;
import com.fixturefactory.exception.ResolutionException;
import com.fixturefactory.util.Reflection;

/**
 * Calls a method of the generated object, e.g. {@code setPassword("secret")}.
 * <p>
 * A call-time value under this declaration's name replaces the positional arguments: it fills
 * the single slot when at most one default was declared, and must be a list or array
 * otherwise. {@code name__key} values are merged into the keyword arguments, which reach
 * the method as a trailing {@link Map} parameter.
 */
public class PostGenerationMethodCall extends PostGenerationDeclaration {

    private final String methodName;
    private final List<Object> defaultArgs;
    private final Map<String, Object> defaultKwargs;

    public PostGenerationMethodCall(String methodName, List<?> defaultArgs, Map<String, Object> defaultKwargs) {
        this.methodName = Objects.requireNonNull(methodName, "methodName");
        this.defaultArgs = Collections.unmodifiableList(new ArrayList<>(defaultArgs));
        this.defaultKwargs = Collections.unmodifiableMap(new LinkedHashMap<>(defaultKwargs));
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.POST_GENERATION_METHOD_CALL;
    }

    public String getMethodName() {
        return methodName;
    }

    @Override
    public Object call(Object instance, BuildStep step, PostGenerationContext context) {
        List<Object> args = context.isValueProvided() ? overriddenArgs(context.getValue()) : defaultArgs;
        Map<String, Object> kwargs = new LinkedHashMap<>(defaultKwargs);
        kwargs.putAll(context.getExtra());
        return Reflection.invokeMethod(instance, methodName, args, kwargs);
    }

    private List<Object> overriddenArgs(Object value) {
        if (defaultArgs.size() <= 1) {
            return Collections.singletonList(value);
        }
        if (value instanceof List) {
            return new ArrayList<>((List<?>) value);
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        throw new ResolutionException(String.format(
                "%s declares %d positional arguments; a call-time override must be a List or array, got %s",
                methodName, defaultArgs.size(), value == null ? "null" : value.getClass().getName()));
    }
}
