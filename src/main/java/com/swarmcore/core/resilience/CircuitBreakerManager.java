package com.swarmcore.core.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Holds one {@link CircuitBreaker} per endpoint, created on first use and kept for the
 * manager's lifetime.
 */
public class CircuitBreakerManager {

    private final int failureThreshold;
    private final Duration coolDown;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerManager(int failureThreshold, Duration coolDown, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    public <T> T execute(String endpoint, Supplier<T> operation) {
        return breaker(endpoint).execute(operation);
    }

    public CircuitBreaker breaker(String endpoint) {
        return breakers.computeIfAbsent(endpoint,
                e -> new CircuitBreaker(e, failureThreshold, coolDown, clock));
    }

    public Optional<CircuitBreakerMetrics> getMetrics(String endpoint) {
        CircuitBreaker breaker = breakers.get(endpoint);
        return breaker == null ? Optional.empty() : Optional.of(breaker.metrics());
    }

    public List<CircuitBreakerMetrics> getAllMetrics() {
        return breakers.values().stream()
                .map(CircuitBreaker::metrics)
                .sorted(Comparator.comparing(CircuitBreakerMetrics::endpoint))
                .toList();
    }

    public void reset(String endpoint) {
        CircuitBreaker breaker = breakers.get(endpoint);
        if (breaker != null) {
            breaker.reset();
        }
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
