package com.swarmcore.backend;

/**
 * A live handle to the external execution backend.
 * <p>
 * The coordinator never interprets payloads or results.
 */
public interface BackendConnection extends AutoCloseable {

    /**
     * Invokes an operation on the backend.
     *
     * @throws BackendException if the backend reports an error or cannot be reached
     */
    String invoke(String endpoint, String payload);

    /**
     * False once the underlying channel is known to be broken.
     */
    boolean isHealthy();

    @Override
    void close();
}
