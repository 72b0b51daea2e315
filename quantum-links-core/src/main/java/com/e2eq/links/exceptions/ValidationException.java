package com.e2eq.links.exceptions;

/**
 * Thrown for malformed entity references, unknown link types or invalid arguments.
 */
public class ValidationException extends LinkEngineException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
