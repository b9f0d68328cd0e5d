package com.swarmcore.core.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
