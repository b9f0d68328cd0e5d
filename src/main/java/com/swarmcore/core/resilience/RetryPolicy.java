package com.swarmcore.core.resilience;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts total attempts including the first
 * @param baseDelay   delay after the first failed attempt
 * @param maxDelay    cap on any single delay
 * @param multiplier  growth factor between consecutive delays
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    public static RetryPolicy exponential(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, 2.0);
    }

    /**
     * Delay before attempt {@code failedAttempts + 1}.
     */
    public Duration delay(int failedAttempts) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        double millis = Math.min(baseDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis((long) millis);
    }
}
