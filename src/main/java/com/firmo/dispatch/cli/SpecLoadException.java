package com.firmo.dispatch.cli;

/**
 * Thrown when a named test spec class cannot be found or instantiated.
 */
public class SpecLoadException extends RuntimeException {
    public SpecLoadException(String message) {
        super(message);
    }

    public SpecLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
