package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

/**
 * Chooses the agent a ready task is assigned to.
 */
public interface SchedulingStrategy {

    String name();

    /**
     * @throws NoCapableAgentException if no eligible agent exists
     */
    Agent selectAgent(Task task, SchedulingContext context);
}
