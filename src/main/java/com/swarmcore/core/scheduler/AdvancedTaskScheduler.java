package com.swarmcore.core.scheduler;

import com.swarmcore.core.conflict.ConflictClaim;
import com.swarmcore.core.conflict.ConflictRecord;
import com.swarmcore.core.conflict.ConflictResolver;
import com.swarmcore.core.conflict.VersionConflictException;
import com.swarmcore.core.conflict.Versioned;
import com.swarmcore.core.events.CoordinationEvent;
import com.swarmcore.core.events.CoordinationEventType;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.resources.InsufficientResourceException;
import com.swarmcore.core.resources.ResourceManager;
import com.swarmcore.core.state.CoordinationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ready-queue scheduler that assigns tasks to agents through a {@link SchedulingStrategy}.
 * <p>
 * Assignment claims the task's resources, moves the task READY to ASSIGNED with a
 * version-checked update, and adds one to the chosen agent's load the same way. If any
 * step fails the earlier steps are rolled back and the task goes back to the queue
 * unchanged. Tasks that stay unassignable for longer than the grace period are failed.
 */
public class AdvancedTaskScheduler extends TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdvancedTaskScheduler.class);

    private final SchedulingStrategy strategy;
    private final CoordinationState state;
    private final ResourceManager resources;
    private final ConflictResolver resolver;
    private final MessageRouter router;
    private final SwarmMetrics metrics;
    private final AffinityTracker affinity;
    private final Duration gracePeriod;
    private final Map<String, Instant> unassignableSince = new ConcurrentHashMap<>();

    public AdvancedTaskScheduler(SchedulingStrategy strategy,
                                 CoordinationState state,
                                 ResourceManager resources,
                                 ConflictResolver resolver,
                                 MessageRouter router,
                                 SwarmMetrics metrics,
                                 AffinityTracker affinity,
                                 Duration gracePeriod,
                                 Clock clock) {
        super(clock);
        this.strategy = strategy;
        this.state = state;
        this.resources = resources;
        this.resolver = resolver;
        this.router = router;
        this.metrics = metrics;
        this.affinity = affinity;
        this.gracePeriod = gracePeriod;
    }

    public SchedulingStrategy strategy() {
        return strategy;
    }

    /**
     * Attempts every queued task once, in dispatch order. Where several queued tasks want
     * the same exclusive resource, the conflict resolver decides which one is tried first.
     *
     * @return one result per task considered
     */
    public List<AssignmentResult> scheduleReady() {
        List<QueuedTask> batch = arbitrateExclusiveResources(drain());
        var results = new ArrayList<AssignmentResult>(batch.size());
        for (QueuedTask entry : batch) {
            results.add(assign(entry));
        }
        if (!results.isEmpty()) {
            long assigned = results.stream().filter(r -> r.outcome() == AssignmentResult.Outcome.ASSIGNED).count();
            log.debug("Scheduling pass: {} assigned of {} considered, {} still queued",
                    assigned, results.size(), queueDepth());
        }
        return results;
    }

    /**
     * Assigns the task if it is queued and READY.
     */
    public AssignmentResult assign(String taskId) {
        return take(taskId)
                .map(this::assign)
                .orElseGet(() -> AssignmentResult.of(taskId, AssignmentResult.Outcome.SKIPPED, "not queued"));
    }

    AssignmentResult assign(QueuedTask entry) {
        Optional<Versioned<Task>> read = state.tasks().read(entry.taskId());
        if (read.isEmpty() || read.get().value().status() != TaskStatus.READY) {
            unassignableSince.remove(entry.taskId());
            return AssignmentResult.of(entry.taskId(), AssignmentResult.Outcome.SKIPPED, "not ready");
        }
        Versioned<Task> current = read.get();
        Task task = current.value();

        Agent agent;
        try {
            agent = strategy.selectAgent(task, new SchedulingContext(state.agentList(), affinity));
        } catch (NoCapableAgentException e) {
            return defer(entry, task, AssignmentResult.Outcome.DEFERRED_NO_AGENT, "no_agent", e.getMessage());
        }

        try {
            resources.claim(task.id(), task.resources());
        } catch (InsufficientResourceException e) {
            return defer(entry, task, AssignmentResult.Outcome.DEFERRED_RESOURCES, "resources", e.getMessage());
        }

        Instant now = clock.instant();
        try {
            state.tasks().tryUpdate(task.id(), current.version(), t -> t.assignTo(agent.id(), now));
        } catch (VersionConflictException e) {
            resources.release(task.id());
            log.debug("Task {} changed while assigning, retrying next cycle: {}", task.id(), e.getMessage());
            return requeueAfterContention(entry);
        }

        try {
            state.agents().update(agent.id(), a -> {
                if (!a.accepting()) {
                    throw new IllegalStateException("Agent " + a.id() + " stopped accepting work");
                }
                return a.withLoad(a.load() + 1, now);
            }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        } catch (VersionConflictException | IllegalStateException e) {
            state.tasks().update(task.id(), Task::unassign, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
            resources.release(task.id());
            log.debug("Agent {} unavailable for task {}, retrying next cycle: {}", agent.id(), task.id(), e.getMessage());
            return requeueAfterContention(entry);
        }

        unassignableSince.remove(task.id());
        metrics.recordAssignment(strategy.name());
        router.publish(CoordinationEvent.of(CoordinationEventType.TASK_ASSIGNED, task.id(), agent.id(),
                Map.of("strategy", strategy.name(), "priority", task.priority()), now));
        log.info("Assigned task {} to agent {} ({})", task.id(), agent.id(), strategy.name());
        return AssignmentResult.assigned(task.id(), agent.id());
    }

    public void recordCompletion(String agentId, Task task) {
        affinity.record(agentId, task, clock.instant());
    }

    /**
     * Forgets grace-period tracking for a task that left the ready state by other means.
     */
    public void forget(String taskId) {
        unassignableSince.remove(taskId);
        remove(taskId);
    }

    private AssignmentResult requeueAfterContention(QueuedTask entry) {
        requeue(entry);
        metrics.recordAssignmentFailure("conflict");
        return AssignmentResult.of(entry.taskId(), AssignmentResult.Outcome.DEFERRED_CONFLICT, "version conflict");
    }

    private AssignmentResult defer(QueuedTask entry, Task task, AssignmentResult.Outcome outcome,
                                   String metricReason, String reason) {
        Instant now = clock.instant();
        Instant since = unassignableSince.computeIfAbsent(task.id(), k -> now);
        metrics.recordAssignmentFailure(metricReason);
        if (Duration.between(since, now).compareTo(gracePeriod) < 0) {
            requeue(entry);
            return AssignmentResult.of(task.id(), outcome, reason);
        }
        String diagnostic = "Unassignable for " + Duration.between(since, now).toSeconds() + "s: " + reason;
        try {
            state.tasks().update(task.id(), t -> t.fail(diagnostic, false), CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        } catch (VersionConflictException e) {
            requeue(entry);
            return AssignmentResult.of(task.id(), AssignmentResult.Outcome.DEFERRED_CONFLICT, e.getMessage());
        }
        unassignableSince.remove(task.id());
        metrics.recordTaskFailed("unassignable", false);
        router.publish(CoordinationEvent.of(CoordinationEventType.TASK_FAILED, task.id(), null,
                Map.of("reason", diagnostic), now));
        log.warn("Task {} failed: {}", task.id(), diagnostic);
        return AssignmentResult.of(task.id(), AssignmentResult.Outcome.FAILED_UNASSIGNABLE, diagnostic);
    }

    /**
     * Moves losers of exclusive-resource contention behind everything else in the batch.
     */
    private List<QueuedTask> arbitrateExclusiveResources(List<QueuedTask> batch) {
        var contenders = new LinkedHashMap<String, List<ConflictClaim>>();
        for (QueuedTask entry : batch) {
            Optional<Versioned<Task>> read = state.tasks().read(entry.taskId());
            if (read.isEmpty()) {
                continue;
            }
            Task task = read.get().value();
            for (String resource : task.resources().amounts().keySet()) {
                if (resources.isExclusive(resource)) {
                    contenders.computeIfAbsent(resource, k -> new ArrayList<>())
                            .add(new ConflictClaim(task.id(), null, read.get().version(),
                                    entry.enqueuedAt(), task.priority()));
                }
            }
        }
        Set<String> losers = new HashSet<>();
        for (var contention : contenders.entrySet()) {
            if (contention.getValue().size() < 2) {
                continue;
            }
            ConflictRecord record = resolver.resolve(contention.getKey(), contention.getValue());
            metrics.recordConflict("resource");
            record.losers().forEach(claim -> losers.add(claim.claimantId()));
        }
        if (losers.isEmpty()) {
            return batch;
        }
        var ordered = new ArrayList<QueuedTask>(batch.size());
        batch.stream().filter(e -> !losers.contains(e.taskId())).forEach(ordered::add);
        batch.stream().filter(e -> losers.contains(e.taskId())).forEach(ordered::add);
        return ordered;
    }
}
