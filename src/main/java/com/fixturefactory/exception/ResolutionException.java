package com.fixturefactory.exception;

/**
 * Raised while resolving the attributes of a single generate call.
 * Nothing has been instantiated when this is thrown from the pre-instantiation phase.
 */
public class ResolutionException extends FactoryException {

    private static final long serialVersionUID = 1L;

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
