package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.util.List;

/**
 * Prefers the eligible agent that most recently completed a task sharing a tag namespace
 * with this one; otherwise the least-loaded eligible agent.
 */
public class AffinitySchedulingStrategy implements SchedulingStrategy {

    @Override
    public String name() {
        return "affinity";
    }

    @Override
    public Agent selectAgent(Task task, SchedulingContext context) {
        List<Agent> eligible = context.eligibleAgents(task);
        if (eligible.isEmpty()) {
            throw new NoCapableAgentException(task.id(), task.requiredCapabilities());
        }
        return context.affinity().preferred(task, eligible)
                .orElseGet(() -> eligible.stream().min(LeastLoadedSchedulingStrategy.LEAST_LOADED).orElseThrow());
    }
}
