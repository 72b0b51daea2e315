package com.e2eq.links.exceptions;

import java.util.List;

/**
 * Raised when workflow propagation or a cascade plan goes deeper than the configured maximum.
 */
public class DepthExceededException extends LinkEngineException {
    private static final long serialVersionUID = 1L;

    private final String key;
    private final int maxDepth;
    private final List<String> stack;

    public DepthExceededException(String key, int maxDepth, List<String> stack) {
        super(String.format("Maximum processing depth %d exceeded while starting '%s' (stack: %s)", maxDepth, key, stack));
        this.key = key;
        this.maxDepth = maxDepth;
        this.stack = List.copyOf(stack);
    }

    public String getKey() {
        return key;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public List<String> getStack() {
        return stack;
    }
}
