package com.swarmcore.core.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One timestamped observation of the coordinator.
 *
 * @param timestamp       when the sample was taken
 * @param queueDepth      ready tasks waiting for assignment
 * @param agentLoads      load per agent id
 * @param endpoints       circuit breaker state per endpoint
 * @param poolUtilization leased connections over pool maximum
 * @param conflictRate    conflicts per assignment since start
 * @param stealRate       migrations per assignment since start
 * @param summary         coordination totals
 */
public record MetricsSample(
    Instant timestamp,
    int queueDepth,
    Map<String, Integer> agentLoads,
    List<EndpointSample> endpoints,
    double poolUtilization,
    double conflictRate,
    double stealRate,
    CoordinationSummary summary
) {

    public MetricsSample {
        agentLoads = Map.copyOf(agentLoads);
        endpoints = List.copyOf(endpoints);
    }
}
