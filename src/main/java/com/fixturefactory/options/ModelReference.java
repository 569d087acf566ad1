package com.fixturefactory.options;

import java.util.Objects;
import java.util.function.Supplier;

import com.fixturefactory.exception.AssociatedClassException;
import com.fixturefactory.util.LazyReference;

/**
 * The model class of a factory, given directly, by fully qualified name or through a supplier.
 * Names and suppliers are resolved on first use, so a factory may be declared before its
 * model class can be loaded.
 */
public final class ModelReference {

    private final LazyReference<Class<?>> reference;
    private final String description;

    private ModelReference(LazyReference<Class<?>> reference, String description) {
        this.reference = reference;
        this.description = description;
    }

    public static ModelReference of(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return new ModelReference(LazyReference.<Class<?>>ofValue(type), type.getName());
    }

    public static ModelReference named(String className) {
        Objects.requireNonNull(className, "className");
        return new ModelReference(LazyReference.of(() -> load(className), className), className);
    }

    public static ModelReference lazy(Supplier<? extends Class<?>> supplier) {
        return new ModelReference(LazyReference.of(supplier, "supplied model"), "supplied model");
    }

    /**
     * @throws AssociatedClassException if a named class cannot be loaded
     */
    public Class<?> resolve() {
        return reference.get();
    }

    /**
     * Class name when known without resolving; used for default factory names and messages.
     */
    public String describe() {
        return reference.isResolved() ? reference.get().getName() : description;
    }

    private static Class<?> load(String className) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            return Class.forName(className, false, loader != null ? loader : ModelReference.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new AssociatedClassException("Model class " + className + " could not be loaded", e);
        }
    }

    @Override
    public String toString() {
        return "ModelReference(" + describe() + ")";
    }
}
