package com.swarmcore.core.health;

import java.util.Map;

/**
 * Health of one coordination component: the dependency graph, the connection pool,
 * the circuit breakers, the event router or the agent roster.
 *
 * @param component component name as reported by {@link HealthCheckService}
 * @param status    UP, DOWN, or DEGRADED while the engine can still make progress
 * @param detail    human-readable summary
 * @param metadata  component counters such as pool utilization or open circuits
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** DEGRADED covers open circuits, dropped events and an empty agent roster. */
    public enum Status { UP, DOWN, DEGRADED }
}
