package com.swarmcore.core.pool;

import com.swarmcore.backend.BackendConnection;
import com.swarmcore.backend.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Bounded pool of reusable backend connections.
 * <p>
 * {@link #acquire()} prefers an idle healthy connection, opens a new one while below
 * capacity, and otherwise blocks until a connection is released or the wait timeout
 * elapses. A background sweep closes connections idle for longer than the idle timeout.
 * {@link #drain(Duration)} refuses new acquisitions and waits for outstanding ones.
 */
public class ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectionFactory factory;
    private final int maxSize;
    private final Duration idleTimeout;
    private final Duration acquireTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Condition emptied = lock.newCondition();
    private final Deque<PooledConnection> idle = new ArrayDeque<>();
    private final Set<PooledConnection> leased = new HashSet<>();
    private final AtomicLong sequence = new AtomicLong();
    private int total;
    private int waiting;
    private long created;
    private long destroyed;
    private boolean draining;

    private ScheduledExecutorService sweeper;

    public ConnectionPool(ConnectionFactory factory, int maxSize, Duration idleTimeout,
                          Duration acquireTimeout, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.factory = factory;
        this.maxSize = maxSize;
        this.idleTimeout = idleTimeout;
        this.acquireTimeout = acquireTimeout;
        this.clock = clock;
    }

    public PooledConnection acquire() {
        return acquire(acquireTimeout);
    }

    /**
     * Borrows a connection, blocking up to {@code timeout} when the pool is at capacity.
     *
     * @throws PoolExhaustedException if nothing frees up in time
     * @throws IllegalStateException  if the pool is draining
     */
    public PooledConnection acquire(Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                if (draining) {
                    throw new IllegalStateException("Connection pool is draining");
                }
                PooledConnection reused = pollIdle();
                if (reused != null) {
                    return lease(reused);
                }
                if (total < maxSize) {
                    return lease(open());
                }
                if (remaining <= 0) {
                    throw new PoolExhaustedException(maxSize, timeout);
                }
                waiting++;
                try {
                    remaining = available.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PoolExhaustedException(maxSize, timeout, e);
                } finally {
                    waiting--;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a connection. Unhealthy connections, and everything released while
     * draining, are closed and their capacity freed.
     */
    public void release(PooledConnection connection) {
        lock.lock();
        try {
            if (!leased.remove(connection)) {
                throw new IllegalArgumentException("Connection " + connection.id() + " is not leased from this pool");
            }
            connection.inUse(false);
            connection.lastUsed(clock.instant());
            if (draining || !connection.healthy()) {
                destroy(connection);
            } else {
                idle.addFirst(connection);
            }
            available.signal();
            if (leased.isEmpty()) {
                emptied.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a connection unhealthy and returns it, so it is discarded.
     */
    public void invalidate(PooledConnection connection) {
        connection.markUnhealthy();
        release(connection);
    }

    /**
     * Borrows a connection for the duration of {@code work}. If the work throws, the
     * connection is invalidated rather than returned to the idle set.
     */
    public <T> T execute(Function<PooledConnection, T> work) {
        PooledConnection connection = acquire();
        T result;
        try {
            result = work.apply(connection);
        } catch (RuntimeException | Error e) {
            invalidate(connection);
            throw e;
        }
        release(connection);
        return result;
    }

    /**
     * Closes idle connections unused for longer than the idle timeout.
     *
     * @return number of connections evicted
     */
    public int evictIdle() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int evicted = 0;
            Iterator<PooledConnection> it = idle.iterator();
            while (it.hasNext()) {
                PooledConnection connection = it.next();
                if (Duration.between(connection.lastUsed(), now).compareTo(idleTimeout) >= 0
                        || !connection.healthy()) {
                    it.remove();
                    destroy(connection);
                    evicted++;
                }
            }
            if (evicted > 0) {
                log.debug("Evicted {} idle connection(s); {} remain open", evicted, total);
                available.signalAll();
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts the background idle sweep.
     */
    public synchronized void start(Duration sweepInterval) {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pool-idle-sweep");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, sweepInterval.toMillis());
        sweeper.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Connection pool started (max={}, idleTimeout={}, sweep={})", maxSize, idleTimeout, sweepInterval);
    }

    /**
     * Stops new acquisitions and waits for every leased connection to come back.
     *
     * @return true if the pool emptied within the timeout
     */
    public boolean drain(Duration timeout) {
        stopSweeper();
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            draining = true;
            available.signalAll();
            while (!idle.isEmpty()) {
                destroy(idle.pollFirst());
            }
            while (!leased.isEmpty()) {
                if (remaining <= 0) {
                    log.warn("Drain timed out with {} connection(s) still leased", leased.size());
                    return false;
                }
                try {
                    remaining = emptied.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            log.info("Connection pool drained ({} opened, {} closed over lifetime)", created, destroyed);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(maxSize, total, idle.size(), leased.size(), waiting, created, destroyed, draining);
        } finally {
            lock.unlock();
        }
    }

    private PooledConnection pollIdle() {
        while (!idle.isEmpty()) {
            PooledConnection candidate = idle.pollFirst();
            if (candidate.healthy()) {
                return candidate;
            }
            destroy(candidate);
        }
        return null;
    }

    private PooledConnection open() {
        String id = "conn-" + sequence.incrementAndGet();
        total++;
        try {
            BackendConnection backend = factory.open(id);
            created++;
            return new PooledConnection(id, backend, clock.instant());
        } catch (RuntimeException e) {
            total--;
            throw e;
        }
    }

    private PooledConnection lease(PooledConnection connection) {
        connection.inUse(true);
        connection.lastUsed(clock.instant());
        leased.add(connection);
        return connection;
    }

    private void destroy(PooledConnection connection) {
        total--;
        destroyed++;
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection {}: {}", connection.id(), e.getMessage());
        }
    }

    private void sweepSafely() {
        try {
            evictIdle();
        } catch (RuntimeException e) {
            log.warn("Idle sweep failed: {}", e.getMessage(), e);
        }
    }

    private synchronized void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }
}
