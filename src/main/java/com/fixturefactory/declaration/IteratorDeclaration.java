package com.fixturefactory.declaration;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import com.fixturefactory.builder.BuildStep;
import com.fixturefactory.builder.Resolver;

/**
 * Hands out successive elements of an {@link Iterable}, one per generate call.
 * <p>
 * The cursor belongs to this declaration instance and is therefore shared by every factory
 * that declares or inherits it. Elements are kept once read, so cycling and {@link #reset()}
 * never re-iterate the source. Without cycling, running out throws {@link NoSuchElementException}.
 */
public class IteratorDeclaration extends Declaration {

    private final Iterable<?> source;
    private final boolean cycle;
    private final Function<Object, ?> getter;

    private final List<Object> consumed = new ArrayList<>();
    private Iterator<?> sourceIterator;
    private boolean sourceExhausted;
    private int position;

    public IteratorDeclaration(Iterable<?> source, boolean cycle, Function<Object, ?> getter) {
        this.source = Objects.requireNonNull(source, "source");
        this.cycle = cycle;
        this.getter = getter != null ? getter : Function.identity();
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.ITERATOR;
    }

    @Override
    public Object evaluate(Resolver resolver, BuildStep step, Map<String, Object> context) {
        return getter.apply(nextElement());
    }

    /**
     * Rewinds to the first element.
     */
    public void reset() {
        position = 0;
    }

    private Object nextElement() {
        if (position < consumed.size()) {
            return consumed.get(position++);
        }
        if (!sourceExhausted) {
            if (sourceIterator == null) {
                sourceIterator = source.iterator();
            }
            if (sourceIterator.hasNext()) {
                Object element = sourceIterator.next();
                consumed.add(element);
                position++;
                return element;
            }
            sourceExhausted = true;
        }
        if (cycle && !consumed.isEmpty()) {
            position = 0;
            return consumed.get(position++);
        }
        throw new NoSuchElementException("Iterator declaration exhausted after " + consumed.size() + " element(s)");
    }
}
