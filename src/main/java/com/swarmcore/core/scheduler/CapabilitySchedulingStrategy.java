package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.util.Comparator;

/**
 * Least-loaded agent among those whose capabilities cover the task. Ties go to the agent
 * with the fewest capabilities beyond those required, then to the smallest id.
 */
public class CapabilitySchedulingStrategy implements SchedulingStrategy {

    @Override
    public String name() {
        return "capability";
    }

    @Override
    public Agent selectAgent(Task task, SchedulingContext context) {
        Comparator<Agent> order = Comparator.comparingInt(Agent::load)
                .thenComparingInt(a -> a.capabilities().size() - task.requiredCapabilities().size())
                .thenComparing(Agent::id);
        return context.eligibleAgents(task).stream()
                .min(order)
                .orElseThrow(() -> new NoCapableAgentException(task.id(), task.requiredCapabilities()));
    }
}
