package com.fixturefactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fixturefactory.exception.FactoryConfigurationException;
import com.fixturefactory.random.RandomState;
import com.fixturefactory.sequence.SequenceRegistry;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Mutable state shared by generate calls: the sequence counters and the random source.
 * <p>
 * Factories use {@link #global()} unless given a runtime of their own. Nested factories always
 * run in the runtime of the outermost call. Not thread-safe.
 */
@Getter
@Builder
public final class FactoryRuntime {
    private static final Logger log = LoggerFactory.getLogger(FactoryRuntime.class);

    /** System property holding the seed of the global random source. */
    public static final String SEED_PROPERTY = "fixturefactory.random.seed";

    private static FactoryRuntime global;

    @NonNull
    @Builder.Default
    private final SequenceRegistry sequences = new SequenceRegistry();

    @NonNull
    @Builder.Default
    private final RandomState random = new RandomState(System.nanoTime());

    /**
     * Process-wide runtime, created on first use. Its random source is seeded from
     * {@value #SEED_PROPERTY} when that property is set.
     */
    public static synchronized FactoryRuntime global() {
        if (global == null) {
            global = FactoryRuntime.builder().random(new RandomState(seedFromProperty())).build();
        }
        return global;
    }

    /**
     * A fresh runtime with its own counters, for test isolation.
     */
    public static FactoryRuntime isolated(long seed) {
        return FactoryRuntime.builder().random(new RandomState(seed)).build();
    }

    public void reseed(long seed) {
        random.reseed(seed);
    }

    private static long seedFromProperty() {
        String configured = System.getProperty(SEED_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return System.nanoTime();
        }
        try {
            long seed = Long.parseLong(configured.trim());
            log.info("Seeding global random state from {}={}", SEED_PROPERTY, seed);
            return seed;
        } catch (NumberFormatException e) {
            throw new FactoryConfigurationException(SEED_PROPERTY + " must be a long, got '" + configured + "'", e);
        }
    }
}
