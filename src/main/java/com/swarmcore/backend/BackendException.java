package com.swarmcore.backend;

/**
 * Thrown when the external backend fails an invocation.
 */
public class BackendException extends RuntimeException {

    private final String endpoint;

    public BackendException(String endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    public BackendException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
