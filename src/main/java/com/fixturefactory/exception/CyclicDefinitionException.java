package com.fixturefactory.exception;

import java.util.List;

/**
 * Lazy declarations that reference each other in a loop.
 */
public class CyclicDefinitionException extends ResolutionException {

    private static final long serialVersionUID = 1L;
    private final List<String> cycle;

    public CyclicDefinitionException(String attributeName, List<String> pending) {
        super("Cyclic lazy attribute definition for '" + attributeName + "'; cycle found in " + pending);
        this.cycle = List.copyOf(pending);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
