package com.e2eq.links.exceptions;

/**
 * Root of the link engine's unchecked exception taxonomy.
 */
public class LinkEngineException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public LinkEngineException(String message) {
        super(message);
    }

    public LinkEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
