package com.swarmcore.core.resilience;

import java.time.Duration;

/**
 * Point-in-time view of one breaker.
 *
 * @param endpoint            endpoint the breaker guards
 * @param state               current state
 * @param consecutiveFailures failures since the last success
 * @param timeInState         time since the last state change
 * @param totalSuccesses      lifetime successful calls
 * @param totalFailures       lifetime failed calls
 * @param totalRejections     lifetime calls rejected without reaching the backend
 */
public record CircuitBreakerMetrics(
    String endpoint,
    CircuitState state,
    int consecutiveFailures,
    Duration timeInState,
    long totalSuccesses,
    long totalFailures,
    long totalRejections
) {

    public double failureRate() {
        long calls = totalSuccesses + totalFailures;
        return calls == 0 ? 0.0 : (double) totalFailures / calls;
    }
}
