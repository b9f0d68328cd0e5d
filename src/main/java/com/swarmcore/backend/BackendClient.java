package com.swarmcore.backend;

import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.pool.PoolExhaustedException;
import com.swarmcore.core.resilience.CircuitBreakerManager;
import com.swarmcore.core.resilience.CircuitOpenException;
import com.swarmcore.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Invokes the backend through a pooled connection, guarded by the endpoint's circuit
 * breaker, retrying backend and pool-capacity failures with exponential backoff.
 * <p>
 * An open circuit is never retried here: the caller decides what to do with the task.
 */
public class BackendClient {

    private static final Logger log = LoggerFactory.getLogger(BackendClient.class);

    private final CircuitBreakerManager breakers;
    private final ConnectionPool pool;
    private final RetryPolicy retryPolicy;
    private final SwarmMetrics metrics;

    public BackendClient(CircuitBreakerManager breakers, ConnectionPool pool,
                         RetryPolicy retryPolicy, SwarmMetrics metrics) {
        this.breakers = breakers;
        this.pool = pool;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    /**
     * @throws CircuitOpenException   if the endpoint's breaker rejects the call
     * @throws BackendException       if every attempt failed in the backend
     * @throws PoolExhaustedException if no connection freed up on the last attempt
     */
    public String invoke(String endpoint, String payload) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            long start = System.currentTimeMillis();
            try {
                String result = pool.execute(conn -> breakers.execute(endpoint, () -> conn.invoke(endpoint, payload)));
                metrics.recordBackendCall(endpoint, true, System.currentTimeMillis() - start);
                return result;
            } catch (CircuitOpenException e) {
                metrics.recordCircuitRejection(endpoint);
                throw e;
            } catch (BackendException | PoolExhaustedException e) {
                metrics.recordBackendCall(endpoint, false, System.currentTimeMillis() - start);
                last = e;
                if (attempt < retryPolicy.maxAttempts()) {
                    Duration delay = retryPolicy.delay(attempt);
                    log.debug("Attempt {}/{} on {} failed ({}), retrying in {}ms",
                            attempt, retryPolicy.maxAttempts(), endpoint, e.getMessage(), delay.toMillis());
                    pause(endpoint, delay);
                }
            }
        }
        log.warn("Backend call to {} failed after {} attempt(s): {}",
                endpoint, retryPolicy.maxAttempts(), last.getMessage());
        throw last;
    }

    private void pause(String endpoint, Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(endpoint, "Interrupted while backing off", e);
        }
    }
}
