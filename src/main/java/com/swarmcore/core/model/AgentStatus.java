package com.swarmcore.core.model;

/**
 * Availability of a worker agent.
 */
public enum AgentStatus {
    IDLE,
    BUSY,
    DRAINING,   // finishing current work, accepts nothing new
    OFFLINE
}
