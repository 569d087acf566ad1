package com.fixturefactory.exception;

/**
 * Base class for every error raised by the factory engine.
 */
public class FactoryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FactoryException(String message) {
        super(message);
    }

    public FactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
