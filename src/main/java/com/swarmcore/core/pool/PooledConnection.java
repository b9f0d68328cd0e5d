package com.swarmcore.core.pool;

import com.swarmcore.backend.BackendConnection;

import java.time.Instant;

/**
 * Pool-owned wrapper around a backend connection.
 * <p>
 * A checked-out connection is lent to exactly one caller until it is released or
 * invalidated. Pool bookkeeping fields are only touched under the pool's lock.
 */
public final class PooledConnection {

    private final String id;
    private final BackendConnection delegate;
    private final Instant createdAt;
    private Instant lastUsed;
    private boolean inUse;
    private volatile boolean healthy = true;

    PooledConnection(String id, BackendConnection delegate, Instant createdAt) {
        this.id = id;
        this.delegate = delegate;
        this.createdAt = createdAt;
        this.lastUsed = createdAt;
    }

    public String id() {
        return id;
    }

    public String invoke(String endpoint, String payload) {
        return delegate.invoke(endpoint, payload);
    }

    /**
     * Flags the connection so the pool discards it on release instead of reusing it.
     */
    public void markUnhealthy() {
        healthy = false;
    }

    public boolean healthy() {
        return healthy && delegate.isHealthy();
    }

    public Instant createdAt() {
        return createdAt;
    }

    Instant lastUsed() {
        return lastUsed;
    }

    void lastUsed(Instant at) {
        this.lastUsed = at;
    }

    boolean inUse() {
        return inUse;
    }

    void inUse(boolean inUse) {
        this.inUse = inUse;
    }

    void close() {
        delegate.close();
    }
}
