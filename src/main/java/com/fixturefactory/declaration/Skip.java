package com.fixturefactory.declaration;

/**
 * Marker value: the attribute is dropped from the model arguments.
 * Produced by a {@link Maybe} branch or a {@link Trait} that has nothing to fall back on.
 */
public enum Skip {
    SKIP
}
