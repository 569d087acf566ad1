package com.fixturefactory.exception;

/**
 * The model could not be constructed or populated from the resolved arguments.
 * Also wraps checked exceptions thrown by reflective collaborators.
 */
public class ModelInstantiationException extends FactoryException {

    private static final long serialVersionUID = 1L;

    public ModelInstantiationException(String message) {
        super(message);
    }

    public ModelInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
