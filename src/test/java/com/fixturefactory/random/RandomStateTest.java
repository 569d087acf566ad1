package com.fixturefactory.random;

import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RandomState.
 */
class RandomStateTest {

    @Test
    void testSameSeedSameValues() {
        RandomState first = new RandomState(42L);
        RandomState second = new RandomState(42L);

        assertThat(draw(first)).containsExactly(draw(second));
    }

    @Test
    void testDifferentSeedsDiverge() {
        assertThat(draw(new RandomState(1L))).isNotEqualTo(draw(new RandomState(2L)));
    }

    @Test
    void testStateCanBeCapturedAndRestored() {
        RandomState random = new RandomState(7L);
        random.nextInt();
        long captured = random.getState();
        int[] expected = draw(random);

        random.setState(captured);

        assertThat(draw(random)).containsExactly(expected);
    }

    @Test
    void testReseed() {
        RandomState random = new RandomState(3L);
        int[] fromSeed = draw(random);

        random.reseed(3L);

        assertThat(draw(random)).containsExactly(fromSeed);
    }

    private static int[] draw(RandomState random) {
        return IntStream.range(0, 8).map(i -> random.nextInt(1000)).toArray();
    }
}
