package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.util.List;

/**
 * What a strategy sees when choosing an agent: a consistent snapshot of the agent table
 * plus affinity history.
 *
 * @param agents   agent snapshots ordered by id
 * @param affinity completion history by tag namespace
 */
public record SchedulingContext(List<Agent> agents, AffinityTracker affinity) {

    public SchedulingContext {
        agents = List.copyOf(agents);
    }

    /**
     * Agents accepting work whose capabilities cover the task's requirements.
     */
    public List<Agent> eligibleAgents(Task task) {
        return agents.stream()
                .filter(Agent::accepting)
                .filter(a -> a.canHandle(task.requiredCapabilities()))
                .toList();
    }
}
