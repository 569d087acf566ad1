package com.fixturefactory.sequence;

import java.util.Map;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One counter per {@link SequenceRoot}, created lazily on first use.
 * <p>
 * Not synchronized: concurrent generation against the same root from several threads
 * may hand out duplicate values. Callers needing thread safety must serialize access or
 * use separate registries.
 */
public class SequenceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SequenceRegistry.class);

    /** Roots are compared by identity; weak keys let discarded factories go away. */
    private final Map<SequenceRoot, SequenceCounter> counters = new WeakHashMap<>();

    public int next(SequenceRoot root) {
        return counterFor(root).next();
    }

    public int peek(SequenceRoot root) {
        return counterFor(root).peek();
    }

    /**
     * @param value next value to hand out, or {@code null} to recompute the root's initial value
     */
    public void reset(SequenceRoot root, Integer value) {
        int next = value != null ? value : root.initialSequence();
        log.debug("Resetting sequence of {} to {}", root.getName(), next);
        SequenceCounter counter = counters.get(root);
        if (counter == null) {
            counters.put(root, new SequenceCounter(next));
        } else {
            counter.reset(next);
        }
    }

    public void clear() {
        counters.clear();
    }

    private SequenceCounter counterFor(SequenceRoot root) {
        return counters.computeIfAbsent(root, r -> {
            int initial = r.initialSequence();
            log.debug("Initialising sequence of {} at {}", r.getName(), initial);
            return new SequenceCounter(initial);
        });
    }
}
