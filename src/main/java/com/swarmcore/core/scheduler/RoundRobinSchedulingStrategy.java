package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through eligible agents in id order, ignoring load.
 */
public class RoundRobinSchedulingStrategy implements SchedulingStrategy {

    private final AtomicLong cursor = new AtomicLong();

    @Override
    public String name() {
        return "round-robin";
    }

    @Override
    public Agent selectAgent(Task task, SchedulingContext context) {
        List<Agent> eligible = context.eligibleAgents(task);
        if (eligible.isEmpty()) {
            throw new NoCapableAgentException(task.id(), task.requiredCapabilities());
        }
        int index = (int) Math.floorMod(cursor.getAndIncrement(), (long) eligible.size());
        return eligible.get(index);
    }
}
