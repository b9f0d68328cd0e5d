package com.swarmcore.core.engine;

import com.swarmcore.core.resilience.RetryPolicy;

import java.time.Duration;

/**
 * Timing and policy knobs for {@link CoordinationManager}.
 *
 * @param cycleInterval         delay between scheduling cycles
 * @param defaultTaskTimeout    run deadline for tasks that declare none
 * @param taskRetryPolicy       backoff between task retries
 * @param stealingEnabled       whether the work-stealing loop runs
 * @param stealingInterval      delay between rebalance passes
 * @param poolSweepInterval     delay between idle-connection sweeps
 * @param metricsSampleInterval delay between metrics samples
 * @param shutdownTimeout       bound on pool drain and event delivery at shutdown
 */
public record CoordinationSettings(
    Duration cycleInterval,
    Duration defaultTaskTimeout,
    RetryPolicy taskRetryPolicy,
    boolean stealingEnabled,
    Duration stealingInterval,
    Duration poolSweepInterval,
    Duration metricsSampleInterval,
    Duration shutdownTimeout
) {

    public static CoordinationSettings defaults() {
        return new CoordinationSettings(
                Duration.ofMillis(250),
                Duration.ofMinutes(10),
                RetryPolicy.exponential(Integer.MAX_VALUE, Duration.ofMillis(500), Duration.ofSeconds(30)),
                true,
                Duration.ofSeconds(2),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                Duration.ofSeconds(10));
    }
}
