package com.fixturefactory.declaration;

/**
 * When a declaration is resolved relative to model instantiation.
 */
public enum BuilderPhase {
    /** Resolved into a model argument before the object exists. */
    ATTRIBUTE_RESOLUTION,
    /** Applied to the object once it has been instantiated. */
    POST_INSTANTIATION
}
