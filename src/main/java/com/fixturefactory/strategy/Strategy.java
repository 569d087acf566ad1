package com.fixturefactory.strategy;

/**
 * How a generate call turns resolved attributes into an object.
 */
public enum Strategy {
    /** Construct the model only. */
    BUILD,
    /** Construct the model, then persist it. */
    CREATE,
    /** Return a {@link StubObject} holding the resolved attributes; the model is never touched. */
    STUB;

    /**
     * The strategy matching the {@code create} flag handed to post-generation hooks.
     */
    public static Strategy fromCreateFlag(boolean create) {
        return create ? CREATE : BUILD;
    }
}
