package com.swarmcore.core.stealing;

import com.swarmcore.core.conflict.VersionConflictException;
import com.swarmcore.core.conflict.Versioned;
import com.swarmcore.core.events.CoordinationEvent;
import com.swarmcore.core.events.CoordinationEventType;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.resources.ResourceManager;
import com.swarmcore.core.state.CoordinationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves assigned but unstarted tasks from overloaded agents to underloaded ones.
 * <p>
 * An agent whose load exceeds the mean by more than the threshold is a donor; one below
 * the mean by more than the threshold is a receiver. Each migration is a version-checked
 * reassignment of one ASSIGNED task, so a task that starts running concurrently is never
 * moved: the start wins the race and the steal is skipped.
 */
public class WorkStealingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkStealingCoordinator.class);

    private static final Comparator<Versioned<Task>> MOST_RECENTLY_ASSIGNED = Comparator
            .comparing((Versioned<Task> v) -> v.value().assignedAt(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(v -> v.value().id(), Comparator.reverseOrder());

    private final CoordinationState state;
    private final ResourceManager resources;
    private final MessageRouter router;
    private final SwarmMetrics metrics;
    private final double threshold;
    private final int maxStealsPerCycle;
    private final Clock clock;
    private final AtomicLong totalSteals = new AtomicLong();
    private final AtomicLong skippedConflicts = new AtomicLong();
    private final Object passLock = new Object();

    private ScheduledExecutorService executor;

    public WorkStealingCoordinator(CoordinationState state,
                                   ResourceManager resources,
                                   MessageRouter router,
                                   SwarmMetrics metrics,
                                   double threshold,
                                   int maxStealsPerCycle,
                                   Clock clock) {
        this.state = state;
        this.resources = resources;
        this.router = router;
        this.metrics = metrics;
        this.threshold = threshold;
        this.maxStealsPerCycle = maxStealsPerCycle;
        this.clock = clock;
    }

    public synchronized void start(Duration interval) {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "work-stealing");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        executor.scheduleAtFixedRate(this::rebalanceSafely, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Work stealing started (interval={}, threshold={}, maxSteals={})",
                interval, threshold, maxStealsPerCycle);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Work stealing stopped");
    }

    /**
     * Asks for an out-of-cycle pass after a load change. Runs on the stealing thread when
     * started, otherwise inline.
     */
    public void requestRebalance() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null) {
            rebalanceSafely();
            return;
        }
        current.execute(this::rebalanceSafely);
    }

    /**
     * One balancing pass.
     *
     * @return number of tasks migrated
     */
    public int rebalance() {
        synchronized (passLock) {
            return rebalancePass();
        }
    }

    private int rebalancePass() {
        List<Agent> online = state.agentList().stream().filter(Agent::online).toList();
        if (online.size() < 2) {
            return 0;
        }
        double mean = online.stream().mapToInt(Agent::load).average().orElse(0);
        List<Agent> donors = online.stream()
                .filter(a -> a.load() - mean > threshold)
                .sorted(Comparator.comparingInt(Agent::load).reversed().thenComparing(Agent::id))
                .toList();
        List<Agent> receivers = online.stream()
                .filter(a -> mean - a.load() > threshold && a.accepting())
                .sorted(Comparator.comparingInt(Agent::load).thenComparing(Agent::id))
                .toList();
        if (donors.isEmpty() || receivers.isEmpty()) {
            return 0;
        }

        int migrated = 0;
        for (Agent donor : donors) {
            for (Agent receiver : receivers) {
                while (migrated < maxStealsPerCycle && stillImbalanced(donor.id(), receiver.id(), mean)) {
                    if (!stealOne(donor.id(), receiver.id())) {
                        break;
                    }
                    migrated++;
                }
            }
        }
        if (migrated > 0) {
            metrics.recordStealBatch(migrated);
            log.info("Rebalanced {} task(s) across {} agents (mean load {})",
                    migrated, online.size(), String.format("%.2f", mean));
        }
        return migrated;
    }

    public List<AgentWorkload> workloads() {
        List<Agent> agents = state.agentList();
        List<Task> tasks = state.taskList();
        double mean = agents.stream().filter(Agent::online).mapToInt(Agent::load).average().orElse(0);
        var result = new ArrayList<AgentWorkload>(agents.size());
        for (Agent agent : agents) {
            int unstarted = 0;
            int running = 0;
            for (Task task : tasks) {
                if (agent.id().equals(task.assignedAgentId())) {
                    if (task.status() == TaskStatus.ASSIGNED) {
                        unstarted++;
                    } else if (task.status() == TaskStatus.RUNNING) {
                        running++;
                    }
                }
            }
            result.add(new AgentWorkload(agent.id(), agent.status(), agent.load(), agent.maxConcurrentTasks(),
                    unstarted, running, agent.load() - mean));
        }
        return result;
    }

    public long totalSteals() {
        return totalSteals.get();
    }

    public long skippedConflicts() {
        return skippedConflicts.get();
    }

    private boolean stillImbalanced(String donorId, String receiverId, double mean) {
        Optional<Agent> donor = state.agent(donorId);
        Optional<Agent> receiver = state.agent(receiverId);
        return donor.isPresent() && receiver.isPresent()
                && donor.get().load() - mean > threshold
                && mean - receiver.get().load() > threshold
                && receiver.get().accepting();
    }

    private boolean stealOne(String donorId, String receiverId) {
        Agent receiver = state.agent(receiverId).orElse(null);
        if (receiver == null) {
            return false;
        }
        Optional<Versioned<Task>> candidate = state.tasks().snapshots().stream()
                .filter(v -> v.value().status() == TaskStatus.ASSIGNED)
                .filter(v -> donorId.equals(v.value().assignedAgentId()))
                .filter(v -> receiver.canHandle(v.value().requiredCapabilities()))
                .filter(v -> resources.holds(v.value().id()))
                .max(MOST_RECENTLY_ASSIGNED);
        if (candidate.isEmpty()) {
            return false;
        }
        return migrate(candidate.get(), donorId, receiverId);
    }

    private boolean migrate(Versioned<Task> candidate, String donorId, String receiverId) {
        String taskId = candidate.id();
        Instant now = clock.instant();
        try {
            state.tasks().tryUpdate(taskId, candidate.version(), t -> t.reassignTo(receiverId, now));
        } catch (VersionConflictException e) {
            skippedConflicts.incrementAndGet();
            log.debug("Skipping steal of {}: {}", taskId, e.getMessage());
            return false;
        }
        try {
            state.agents().update(receiverId, a -> {
                if (!a.accepting()) {
                    throw new IllegalStateException("Agent " + a.id() + " stopped accepting work");
                }
                return a.withLoad(a.load() + 1, now);
            }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        } catch (VersionConflictException | IllegalStateException e) {
            state.tasks().update(taskId, t -> t.reassignTo(donorId, now), CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
            skippedConflicts.incrementAndGet();
            log.debug("Receiver {} unavailable, task {} stays with {}: {}", receiverId, taskId, donorId, e.getMessage());
            return false;
        }
        state.adjustLoad(donorId, -1);

        totalSteals.incrementAndGet();
        metrics.recordSteal();
        router.publish(CoordinationEvent.of(CoordinationEventType.TASK_STOLEN, taskId, receiverId,
                Map.of("from", donorId, "to", receiverId), now));
        log.info("Moved task {} from agent {} to agent {}", taskId, donorId, receiverId);
        return true;
    }

    private void rebalanceSafely() {
        try {
            rebalance();
        } catch (RuntimeException e) {
            log.warn("Rebalance pass failed: {}", e.getMessage(), e);
        }
    }
}
