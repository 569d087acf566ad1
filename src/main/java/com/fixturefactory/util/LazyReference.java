package com.fixturefactory.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A write-once cell whose value is computed on first access.
 * <p>
 * Used for model classes and factories that cannot be referenced eagerly,
 * typically two factories pointing at each other. Not thread-safe.
 */
public final class LazyReference<T> implements Supplier<T> {

    private final Supplier<? extends T> loader;
    private final String description;
    private T value;
    private boolean loaded;

    private LazyReference(Supplier<? extends T> loader, String description) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.description = description;
    }

    public static <T> LazyReference<T> of(Supplier<? extends T> loader) {
        return new LazyReference<>(loader, "lazy");
    }

    public static <T> LazyReference<T> of(Supplier<? extends T> loader, String description) {
        return new LazyReference<>(loader, description);
    }

    public static <T> LazyReference<T> ofValue(T value) {
        LazyReference<T> reference = new LazyReference<>(() -> value, String.valueOf(value));
        reference.value = value;
        reference.loaded = true;
        return reference;
    }

    @Override
    public T get() {
        if (!loaded) {
            T loadedValue = loader.get();
            if (loadedValue == null) {
                throw new IllegalStateException("Lazy reference " + description + " resolved to null");
            }
            value = loadedValue;
            loaded = true;
        }
        return value;
    }

    public boolean isResolved() {
        return loaded;
    }

    @Override
    public String toString() {
        return loaded ? "LazyReference[" + value + "]" : "LazyReference[" + description + ", unresolved]";
    }
}
