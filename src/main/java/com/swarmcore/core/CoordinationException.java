package com.swarmcore.core;

/**
 * Base type for control-flow errors raised by the coordination engine.
 * <p>
 * Subclasses are unchecked: callers decide whether to retry or surface them.
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
