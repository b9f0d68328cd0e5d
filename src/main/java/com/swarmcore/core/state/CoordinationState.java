package com.swarmcore.core.state;

import com.swarmcore.core.conflict.OptimisticLockManager;
import com.swarmcore.core.conflict.Versioned;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The task table and agent table shared by the scheduler, the work-stealing coordinator
 * and the coordination manager. Every mutation goes through a version-checked update on
 * one entity.
 */
public class CoordinationState {

    /** Attempts made by read-modify-write helpers before giving up on a contended entity. */
    public static final int DEFAULT_UPDATE_ATTEMPTS = 5;

    private final OptimisticLockManager<Task> tasks;
    private final OptimisticLockManager<Agent> agents;
    private final Clock clock;

    public CoordinationState(Clock clock) {
        this.clock = clock;
        this.tasks = new OptimisticLockManager<>("tasks", clock);
        this.agents = new OptimisticLockManager<>("agents", clock);
    }

    public OptimisticLockManager<Task> tasks() {
        return tasks;
    }

    public OptimisticLockManager<Agent> agents() {
        return agents;
    }

    public Clock clock() {
        return clock;
    }

    public Optional<Task> task(String id) {
        return tasks.read(id).map(Versioned::value);
    }

    public Optional<Agent> agent(String id) {
        return agents.read(id).map(Versioned::value);
    }

    /**
     * Agents ordered by id.
     */
    public List<Agent> agentList() {
        return agents.values().stream().sorted(Comparator.comparing(Agent::id)).toList();
    }

    public List<Task> taskList() {
        return tasks.values().stream().sorted(Comparator.comparing(Task::id)).toList();
    }

    /**
     * Adds {@code delta} to the agent's load, retrying on contention.
     */
    public Versioned<Agent> adjustLoad(String agentId, int delta) {
        return agents.update(agentId, a -> a.withLoad(a.load() + delta, clock.instant()), DEFAULT_UPDATE_ATTEMPTS);
    }

    public long conflictCount() {
        return tasks.conflictCount() + agents.conflictCount();
    }
}
