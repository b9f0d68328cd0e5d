package com.swarmcore.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Failure-isolation state machine for a single endpoint.
 * <p>
 * CLOSED counts consecutive failures and opens at the threshold. OPEN rejects every
 * call until the cool-down has elapsed; the first call after that becomes the one
 * HALF_OPEN probe. Callers arriving while the probe is in flight are rejected. A
 * successful probe closes the breaker, a failed one reopens it and restarts the cool-down.
 * <p>
 * State is guarded by this breaker's monitor; the guarded call itself runs unlocked.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String endpoint;
    private final int failureThreshold;
    private final Duration coolDown;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastStateChange;
    private boolean probeInFlight;
    private long totalSuccesses;
    private long totalFailures;
    private long totalRejections;

    public CircuitBreaker(String endpoint, int failureThreshold, Duration coolDown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.endpoint = endpoint;
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.clock = clock;
        this.lastStateChange = clock.instant();
    }

    /**
     * Runs the operation if the breaker admits it.
     *
     * @throws CircuitOpenException if the call is rejected; the operation is not invoked
     */
    public <T> T execute(Supplier<T> operation) {
        boolean probe = acquirePermission();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            onFailure(probe);
            throw e;
        }
        onSuccess(probe);
        return result;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public synchronized CircuitBreakerMetrics metrics() {
        return new CircuitBreakerMetrics(endpoint, state, consecutiveFailures,
                Duration.between(lastStateChange, clock.instant()),
                totalSuccesses, totalFailures, totalRejections);
    }

    /**
     * Forces the breaker closed and clears the failure counter.
     */
    public synchronized void reset() {
        probeInFlight = false;
        consecutiveFailures = 0;
        transitionTo(CircuitState.CLOSED);
    }

    private synchronized boolean acquirePermission() {
        switch (state) {
            case CLOSED:
                return false;
            case OPEN: {
                Duration elapsed = Duration.between(lastStateChange, clock.instant());
                if (elapsed.compareTo(coolDown) >= 0) {
                    transitionTo(CircuitState.HALF_OPEN);
                    probeInFlight = true;
                    return true;
                }
                totalRejections++;
                throw new CircuitOpenException(endpoint, coolDown.minus(elapsed));
            }
            case HALF_OPEN:
            default:
                if (!probeInFlight) {
                    probeInFlight = true;
                    return true;
                }
                totalRejections++;
                throw new CircuitOpenException(endpoint, Duration.ZERO);
        }
    }

    private synchronized void onSuccess(boolean probe) {
        totalSuccesses++;
        consecutiveFailures = 0;
        if (probe) {
            probeInFlight = false;
            transitionTo(CircuitState.CLOSED);
        }
    }

    private synchronized void onFailure(boolean probe) {
        totalFailures++;
        if (probe) {
            probeInFlight = false;
            transitionTo(CircuitState.OPEN);
            return;
        }
        consecutiveFailures++;
        if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            transitionTo(CircuitState.OPEN);
        }
    }

    private void transitionTo(CircuitState next) {
        if (state != next) {
            log.info("Circuit for {} moved {} -> {} (consecutive failures: {})",
                    endpoint, state, next, consecutiveFailures);
        }
        state = next;
        lastStateChange = clock.instant();
    }
}
