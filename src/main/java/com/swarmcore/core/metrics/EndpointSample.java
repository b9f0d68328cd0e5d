package com.swarmcore.core.metrics;

import com.swarmcore.core.resilience.CircuitState;

public record EndpointSample(String endpoint, CircuitState state, int consecutiveFailures, double failureRate) {}
