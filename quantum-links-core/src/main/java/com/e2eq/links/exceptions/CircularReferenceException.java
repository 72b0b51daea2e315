package com.e2eq.links.exceptions;

import java.util.List;

/**
 * Raised by the processing guard when an entity is re-entered while it is still being processed.
 */
public class CircularReferenceException extends LinkEngineException {
    private static final long serialVersionUID = 1L;

    private final String key;
    private final List<String> stack;

    public CircularReferenceException(String key, List<String> stack) {
        super(String.format("Circular reference detected: '%s' is already being processed (stack: %s)", key, stack));
        this.key = key;
        this.stack = List.copyOf(stack);
    }

    public String getKey() {
        return key;
    }

    public List<String> getStack() {
        return stack;
    }
}
