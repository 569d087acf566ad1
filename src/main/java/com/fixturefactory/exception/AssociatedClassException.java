package com.fixturefactory.exception;

/**
 * Raised when generating from a factory that has no usable model class
 * (abstract, or a model name that cannot be loaded).
 */
public class AssociatedClassException extends FactoryConfigurationException {

    private static final long serialVersionUID = 1L;

    public AssociatedClassException(String message) {
        super(message);
    }

    public AssociatedClassException(String message, Throwable cause) {
        super(message, cause);
    }
}
