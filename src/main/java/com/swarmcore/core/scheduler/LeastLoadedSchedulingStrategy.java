package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.util.Comparator;

public class LeastLoadedSchedulingStrategy implements SchedulingStrategy {

    static final Comparator<Agent> LEAST_LOADED = Comparator.comparingInt(Agent::load).thenComparing(Agent::id);

    @Override
    public String name() {
        return "least-loaded";
    }

    @Override
    public Agent selectAgent(Task task, SchedulingContext context) {
        return context.eligibleAgents(task).stream()
                .min(LEAST_LOADED)
                .orElseThrow(() -> new NoCapableAgentException(task.id(), task.requiredCapabilities()));
    }
}
