package com.swarmcore.core.stealing;

import com.swarmcore.core.model.AgentStatus;

/**
 * Load of one agent relative to the pool mean.
 *
 * @param agentId      agent id
 * @param status       availability
 * @param load         assigned plus running tasks
 * @param capacity     maximum concurrent tasks
 * @param unstarted    ASSIGNED tasks that could be migrated
 * @param running      RUNNING tasks, never migrated
 * @param deviation    load minus the mean load of online agents
 */
public record AgentWorkload(
    String agentId,
    AgentStatus status,
    int load,
    int capacity,
    int unstarted,
    int running,
    double deviation
) {}
