package com.fixturefactory.declaration;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IteratorDeclaration.
 */
class IteratorDeclarationTest {

    @Test
    void testCyclesOverElements() {
        IteratorDeclaration declaration = new IteratorDeclaration(List.of("a", "b"), true, null);

        assertThat(next(declaration, 5)).containsExactly("a", "b", "a", "b", "a");
    }

    @Test
    void testSourceIsIteratedOnlyOnce() {
        AtomicInteger iterations = new AtomicInteger();
        Iterable<String> source = () -> {
            iterations.incrementAndGet();
            return List.of("x", "y").iterator();
        };
        IteratorDeclaration declaration = new IteratorDeclaration(source, true, null);

        next(declaration, 6);
        declaration.reset();
        next(declaration, 2);

        assertThat(iterations).hasValue(1);
    }

    @Test
    void testExhaustionWithoutCycling() {
        IteratorDeclaration declaration = new IteratorDeclaration(List.of(1), false, null);

        assertThat(next(declaration, 1)).containsExactly(1);
        assertThatThrownBy(() -> next(declaration, 1)).isInstanceOf(NoSuchElementException.class);

        declaration.reset();
        assertThat(next(declaration, 1)).containsExactly(1);
    }

    @Test
    void testEmptySourceFailsEvenWhenCycling() {
        IteratorDeclaration declaration = new IteratorDeclaration(List.of(), true, null);

        assertThatThrownBy(() -> next(declaration, 1)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testGetterIsApplied() {
        IteratorDeclaration declaration = new IteratorDeclaration(List.of("en_US", "fr_FR"), true,
                value -> value.toString().substring(0, 2));

        assertThat(next(declaration, 3)).containsExactly("en", "fr", "en");
    }

    private static List<Object> next(IteratorDeclaration declaration, int count) {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(declaration.evaluate(null, null, Map.of()));
        }
        return values;
    }
}
