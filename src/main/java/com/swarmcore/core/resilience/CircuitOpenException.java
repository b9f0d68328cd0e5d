package com.swarmcore.core.resilience;

import com.swarmcore.core.CoordinationException;

import java.time.Duration;

/**
 * Thrown when a call is rejected because the endpoint's breaker is open,
 * or because a half-open probe is already in flight.
 */
public class CircuitOpenException extends CoordinationException {

    private final String endpoint;
    private final Duration retryAfter;

    public CircuitOpenException(String endpoint, Duration retryAfter) {
        super("Circuit open for endpoint " + endpoint + " (retry after " + retryAfter.toMillis() + "ms)");
        this.endpoint = endpoint;
        this.retryAfter = retryAfter;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
