package com.fixturefactory.random;

import java.util.Random;

/**
 * Seedable random source whose whole state is a single {@code long}, so it can be captured
 * and restored for reproducible fixtures.
 * <p>
 * Uses the SplitMix64 generator. {@link #nextGaussian()} keeps the cached second value of
 * {@link Random}, which is not part of the captured state.
 */
public class RandomState extends Random {

    private static final long serialVersionUID = 1L;
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private long state;

    public RandomState(long seed) {
        super(seed);
        this.state = seed;
    }

    public long getState() {
        return state;
    }

    public void setState(long state) {
        this.state = state;
    }

    public void reseed(long seed) {
        setState(seed);
    }

    @Override
    public void setSeed(long seed) {
        this.state = seed;
    }

    @Override
    protected int next(int bits) {
        return (int) (nextRaw() >>> (64 - bits));
    }

    private long nextRaw() {
        state += GOLDEN_GAMMA;
        long z = state;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
