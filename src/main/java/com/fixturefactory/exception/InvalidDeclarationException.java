package com.fixturefactory.exception;

import java.util.List;

/**
 * Raised when a set of declarations is inconsistent.
 * Can hold several problems at once so they are reported together.
 */
public class InvalidDeclarationException extends FactoryConfigurationException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public InvalidDeclarationException(String message) {
        this(List.of(message));
    }

    public InvalidDeclarationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
