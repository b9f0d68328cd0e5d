package com.swarmcore.core.pool;

import com.swarmcore.core.CoordinationException;

import java.time.Duration;

/**
 * Thrown when no connection became available within the acquire timeout.
 */
public class PoolExhaustedException extends CoordinationException {

    private final int maxSize;
    private final Duration waited;

    public PoolExhaustedException(int maxSize, Duration waited) {
        super("Connection pool exhausted (max " + maxSize + ") after waiting " + waited.toMillis() + "ms");
        this.maxSize = maxSize;
        this.waited = waited;
    }

    public PoolExhaustedException(int maxSize, Duration waited, Throwable cause) {
        super("Interrupted while waiting for a connection (max " + maxSize + ")", cause);
        this.maxSize = maxSize;
        this.waited = waited;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getWaited() {
        return waited;
    }
}
