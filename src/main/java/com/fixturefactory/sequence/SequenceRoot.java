package com.fixturefactory.sequence;

/**
 * Owner of a sequence counter. All factories sharing a root share one counter.
 */
public interface SequenceRoot {

    /**
     * First value handed out after creation or after a reset without an explicit value.
     * Called at most once per registry until the next reset.
     */
    int initialSequence();

    String getName();
}
