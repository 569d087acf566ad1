package com.fixturefactory.exception;

/**
 * A factory was declared or used in a way that can never succeed,
 * regardless of the call-time overrides.
 */
public class FactoryConfigurationException extends FactoryException {

    private static final long serialVersionUID = 1L;

    public FactoryConfigurationException(String message) {
        super(message);
    }

    public FactoryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
