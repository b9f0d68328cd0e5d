package com.swarmcore.backend;

/**
 * Opens new backend connections on behalf of the pool.
 */
@FunctionalInterface
public interface ConnectionFactory {

    BackendConnection open(String connectionId);
}
