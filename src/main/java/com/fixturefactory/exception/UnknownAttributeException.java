package com.fixturefactory.exception;

/**
 * An attribute path referenced a name that no declaration, override or object property provides.
 */
public class UnknownAttributeException extends ResolutionException {

    private static final long serialVersionUID = 1L;
    private final String attributeName;

    public UnknownAttributeException(String attributeName, String message) {
        super(message);
        this.attributeName = attributeName;
    }

    public UnknownAttributeException(String attributeName, String message, Throwable cause) {
        super(message, cause);
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
