package com.swarmcore.core.engine;

import com.swarmcore.backend.BackendClient;
import com.swarmcore.core.CoordinationException;
import com.swarmcore.core.conflict.VersionConflictException;
import com.swarmcore.core.conflict.Versioned;
import com.swarmcore.core.events.CoordinationEvent;
import com.swarmcore.core.events.CoordinationEventType;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.graph.DependencyGraph;
import com.swarmcore.core.logging.MdcContext;
import com.swarmcore.core.memory.CheckpointService;
import com.swarmcore.core.metrics.CoordinationMetricsCollector;
import com.swarmcore.core.metrics.MetricsSample;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.AgentStatus;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.resources.ResourceManager;
import com.swarmcore.core.scheduler.AdvancedTaskScheduler;
import com.swarmcore.core.scheduler.AssignmentResult;
import com.swarmcore.core.state.CoordinationState;
import com.swarmcore.core.state.TaskStatusSnapshot;
import com.swarmcore.core.stealing.WorkStealingCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Owns the task and agent tables and drives every coordination component.
 * <p>
 * Submitted tasks enter the dependency graph; tasks whose dependencies have completed are
 * promoted to READY and queued; each cycle assigns queued tasks, re-queues due retries and
 * fails tasks past their deadline. Agents report progress through {@link #startTask},
 * {@link #completeTask} and {@link #failTask}, or run a task end to end with
 * {@link #execute}. Task and agent snapshots are checkpointed from the event stream.
 * <p>
 * Lifecycle is explicit: {@link #start()} recovers checkpoints and starts the background
 * loops, {@link #shutdown()} stops them, drains the pool, takes a final metrics sample and
 * delivers outstanding events.
 */
public class CoordinationManager {

    private static final Logger log = LoggerFactory.getLogger(CoordinationManager.class);

    private static final String CANCEL_REASON = "Cancelled";

    private static final Set<TaskStatus> IN_FLIGHT = EnumSet.of(TaskStatus.ASSIGNED, TaskStatus.RUNNING);

    private final CoordinationState state;
    private final DependencyGraph graph;
    private final AdvancedTaskScheduler scheduler;
    private final WorkStealingCoordinator stealing;
    private final ResourceManager resources;
    private final ConnectionPool pool;
    private final MessageRouter router;
    private final CoordinationMetricsCollector collector;
    private final CheckpointService checkpoints;
    private final BackendClient backend;
    private final SwarmMetrics metrics;
    private final CoordinationSettings settings;
    private final Clock clock;

    private final Map<String, Instant> retryAt = new ConcurrentHashMap<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService cycleExecutor;
    private volatile boolean running;
    private boolean stopped;

    public CoordinationManager(CoordinationState state,
                               DependencyGraph graph,
                               AdvancedTaskScheduler scheduler,
                               WorkStealingCoordinator stealing,
                               ResourceManager resources,
                               ConnectionPool pool,
                               MessageRouter router,
                               CoordinationMetricsCollector collector,
                               CheckpointService checkpoints,
                               BackendClient backend,
                               SwarmMetrics metrics,
                               CoordinationSettings settings) {
        this.state = state;
        this.graph = graph;
        this.scheduler = scheduler;
        this.stealing = stealing;
        this.resources = resources;
        this.pool = pool;
        this.router = router;
        this.collector = collector;
        this.checkpoints = checkpoints;
        this.backend = backend;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = state.clock();
        router.subscribe("checkpoint", Set.of(), this::checkpoint);
    }

    // --- Lifecycle ---

    /**
     * Recovers checkpoints and starts the scheduling, stealing, sweep and sampling loops.
     */
    public synchronized void start() {
        if (running || stopped) {
            return;
        }
        recover();
        pool.start(settings.poolSweepInterval());
        if (settings.stealingEnabled()) {
            stealing.start(settings.stealingInterval());
        }
        collector.start(settings.metricsSampleInterval());
        cycleExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "coordination-cycle");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, settings.cycleInterval().toMillis());
        cycleExecutor.scheduleWithFixedDelay(this::runCycleSafely, 0, millis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Coordination manager started (strategy={}, cycle={}, stealing={})",
                scheduler.strategy().name(), settings.cycleInterval(), settings.stealingEnabled());
    }

    /**
     * Stops the loops, drains the pool, flushes a final metrics sample and shuts the router down.
     */
    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        running = false;
        if (cycleExecutor != null) {
            cycleExecutor.shutdown();
            try {
                if (!cycleExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    cycleExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                cycleExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        stealing.stop();
        collector.stop();
        if (!pool.drain(settings.shutdownTimeout())) {
            log.warn("Connection pool did not drain within {}", settings.shutdownTimeout());
        }
        collector.sample();
        router.shutdown(settings.shutdownTimeout());
        log.info("Coordination manager stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // --- Agents ---

    public Versioned<Agent> registerAgent(Agent agent) {
        Versioned<Agent> registered = state.agents().register(agent.id(), agent);
        publish(CoordinationEventType.AGENT_REGISTERED, null, agent.id(),
                Map.of("capabilities", agent.capabilities(), "maxConcurrentTasks", agent.maxConcurrentTasks()));
        log.info("Registered agent {} with capabilities {}", agent.id(), agent.capabilities());
        if (running && settings.stealingEnabled()) {
            stealing.requestRebalance();
        }
        return registered;
    }

    /**
     * Takes an agent offline and removes it. Its unstarted tasks return to the ready queue;
     * its running tasks fail and are retried if they have retries left.
     *
     * @return false if the agent was unknown
     */
    public boolean removeAgent(String agentId) {
        if (state.agent(agentId).isEmpty()) {
            return false;
        }
        state.agents().update(agentId, a -> a.withStatus(AgentStatus.OFFLINE), CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        for (Task task : state.taskList()) {
            if (!agentId.equals(task.assignedAgentId())) {
                continue;
            }
            if (task.status() == TaskStatus.ASSIGNED) {
                try {
                    state.tasks().update(task.id(), t -> {
                        requireStatus(t, TaskStatus.ASSIGNED);
                        return t.unassign();
                    }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
                    resources.release(task.id());
                    scheduler.enqueue(task);
                    log.info("Returned task {} to the queue after agent {} left", task.id(), agentId);
                } catch (IllegalStateException | VersionConflictException e) {
                    log.debug("Task {} moved on while agent {} was being removed: {}", task.id(), agentId, e.getMessage());
                }
            } else if (task.status() == TaskStatus.RUNNING) {
                try {
                    failTask(task.id(), agentId, task.retryCount(),
                            new CoordinationException("Agent " + agentId + " was removed"));
                } catch (IllegalStateException | StaleAttemptException e) {
                    log.debug("Task {} finished while agent {} was being removed", task.id(), agentId);
                }
            }
        }
        state.agents().remove(agentId);
        publish(CoordinationEventType.AGENT_REMOVED, null, agentId, Map.of());
        log.info("Removed agent {}", agentId);
        return true;
    }

    // --- Task intake ---

    /**
     * Adds a PENDING task. A task whose dependencies are already complete is queued at once;
     * a task depending on a task that already failed or was cancelled is cancelled at once.
     *
     * @throws com.swarmcore.core.graph.CycleException if its dependencies would close a cycle
     * @throws IllegalArgumentException                if the id is taken or the task is not PENDING
     */
    public TaskStatusSnapshot submit(Task task) {
        if (task.status() != TaskStatus.PENDING) {
            throw new IllegalArgumentException("Task " + task.id() + " must be submitted as PENDING, was " + task.status());
        }
        if (state.task(task.id()).isPresent()) {
            throw new IllegalArgumentException("Task already submitted: " + task.id());
        }
        Task stamped = Instant.EPOCH.equals(task.createdAt()) ? task.withCreatedAt(clock.instant()) : task;
        graph.addTask(stamped.id(), stamped.dependencies());
        Versioned<Task> registered;
        try {
            registered = state.tasks().register(stamped.id(), stamped);
        } catch (IllegalArgumentException e) {
            graph.removeTask(stamped.id(), true);
            throw e;
        }
        publish(CoordinationEventType.TASK_SUBMITTED, stamped.id(), null,
                Map.of("priority", stamped.priority(), "dependencies", stamped.dependencies()));
        log.info("Submitted task {} (priority={}, dependencies={})",
                stamped.id(), stamped.priority(), stamped.dependencies());
        Optional<String> dead = stamped.dependencies().stream().filter(this::cannotComplete).findFirst();
        if (dead.isPresent()) {
            log.info("Task {} depends on {}, which will never complete", stamped.id(), dead.get());
            cancel(stamped.id());
        } else {
            promoteReady(Set.of(stamped.id()));
        }
        return snapshotOf(state.tasks().read(stamped.id()).orElse(registered));
    }

    // --- Scheduling cycle ---

    /**
     * One scheduling cycle: promote ready tasks and due retries, assign queued tasks, and
     * fail tasks past their deadline.
     *
     * @return the assignment results of this cycle
     */
    public List<AssignmentResult> runCycle() {
        promoteReady(graph.getReadyTasks());
        requeueDueRetries();
        List<AssignmentResult> results = scheduler.scheduleReady();
        for (AssignmentResult result : results) {
            if (result.outcome() == AssignmentResult.Outcome.FAILED_UNASSIGNABLE) {
                graph.markFailed(result.taskId());
                cancelDependentsOf(result.taskId());
            }
        }
        checkDeadlines();
        return results;
    }

    /**
     * Fails every RUNNING task past its deadline with a {@link TaskTimeoutException}.
     *
     * @return number of tasks timed out
     */
    public int checkDeadlines() {
        Instant now = clock.instant();
        int timedOut = 0;
        for (Task task : state.taskList()) {
            if (task.status() != TaskStatus.RUNNING || task.startedAt() == null) {
                continue;
            }
            Duration timeout = task.timeout() != null ? task.timeout() : settings.defaultTaskTimeout();
            if (Duration.between(task.startedAt(), now).compareTo(timeout) > 0) {
                try {
                    failTask(task.id(), task.assignedAgentId(), task.retryCount(),
                            new TaskTimeoutException(task.id(), timeout));
                    timedOut++;
                } catch (IllegalStateException | StaleAttemptException e) {
                    log.debug("Task {} finished while its deadline was checked", task.id());
                }
            }
        }
        return timedOut;
    }

    // --- Agent-side task lifecycle ---

    /**
     * Marks an assigned task as running on its agent.
     *
     * @throws IllegalStateException if the task is not ASSIGNED to {@code agentId}
     */
    public TaskStatusSnapshot startTask(String taskId, String agentId) {
        Instant now = clock.instant();
        Versioned<Task> started = state.tasks().update(taskId, t -> {
            requireStatus(t, TaskStatus.ASSIGNED);
            if (!agentId.equals(t.assignedAgentId())) {
                throw new IllegalStateException("Task " + taskId + " is assigned to " + t.assignedAgentId()
                        + ", not " + agentId);
            }
            return t.start(now);
        }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        publish(CoordinationEventType.TASK_STARTED, taskId, agentId, Map.of());
        log.debug("Task {} started on agent {}", taskId, agentId);
        return snapshotOf(started);
    }

    /**
     * Records a successful run. A task whose cancellation was requested while it ran ends
     * CANCELLED instead.
     */
    public TaskStatusSnapshot completeTask(String taskId) {
        return complete(taskId, t -> { });
    }

    /**
     * Records a successful run of one attempt, identified by the agent that ran it and the
     * retry count it started with.
     *
     * @throws StaleAttemptException if that attempt is no longer the task's current run
     */
    public TaskStatusSnapshot completeTask(String taskId, String agentId, int attempt) {
        return complete(taskId, t -> requireAttempt(t, agentId, attempt, Set.of(TaskStatus.RUNNING)));
    }

    private TaskStatusSnapshot complete(String taskId, Consumer<Task> attemptCheck) {
        if (cancelRequested.contains(taskId)) {
            attemptCheck.accept(state.tasks().require(taskId).value());
            return acknowledgeCancellation(taskId);
        }
        Instant now = clock.instant();
        Versioned<Task> completed = state.tasks().update(taskId, t -> {
            attemptCheck.accept(t);
            requireStatus(t, TaskStatus.RUNNING);
            return t.withStatus(TaskStatus.COMPLETED);
        }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        Task task = completed.value();
        String agentId = task.assignedAgentId();
        long executionMs = task.startedAt() == null ? 0 : Duration.between(task.startedAt(), now).toMillis();

        resources.release(taskId);
        updateAgent(agentId, a -> a.recordCompletion(executionMs, now));
        scheduler.recordCompletion(agentId, task);
        metrics.recordTaskCompleted(executionMs);
        publish(CoordinationEventType.TASK_COMPLETED, taskId, agentId, Map.of("executionMs", executionMs));
        log.info("Task {} completed on agent {} in {}ms", taskId, agentId, executionMs);

        promoteReady(graph.markCompleted(taskId));
        return snapshotOf(completed);
    }

    /**
     * Records a failed run. The task is retried after an exponential backoff while it has
     * retries left; otherwise it stays FAILED and its dependents are cancelled.
     */
    public TaskStatusSnapshot failTask(String taskId, Throwable cause) {
        return fail(taskId, cause, t -> { });
    }

    /**
     * Records a failed run of one attempt, identified by the agent that ran it and the
     * retry count it started with.
     *
     * @throws StaleAttemptException if that attempt is no longer the task's current run
     */
    public TaskStatusSnapshot failTask(String taskId, String agentId, int attempt, Throwable cause) {
        return fail(taskId, cause, t -> requireAttempt(t, agentId, attempt, IN_FLIGHT));
    }

    private TaskStatusSnapshot fail(String taskId, Throwable cause, Consumer<Task> attemptCheck) {
        if (cancelRequested.contains(taskId)) {
            attemptCheck.accept(state.tasks().require(taskId).value());
            return acknowledgeCancellation(taskId);
        }
        Instant now = clock.instant();
        String reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        var retryConsumed = new AtomicBoolean();
        Versioned<Task> failed = state.tasks().update(taskId, t -> {
            attemptCheck.accept(t);
            if (!IN_FLIGHT.contains(t.status())) {
                throw new IllegalStateException("Task " + taskId + " is " + t.status() + ", not in flight");
            }
            retryConsumed.set(t.retriesLeft());
            return t.fail(reason, t.retriesLeft());
        }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        Task task = failed.value();
        String agentId = task.assignedAgentId();
        boolean retrying = retryConsumed.get();

        resources.release(taskId);
        updateAgent(agentId, a -> a.recordFailure(now));
        metrics.recordTaskFailed(failureKind(cause), retrying);

        if (retrying) {
            Duration delay = settings.taskRetryPolicy().delay(task.retryCount());
            retryAt.put(taskId, now.plus(delay));
            log.warn("Task {} failed on agent {} (retry {}/{} in {}ms): {}",
                    taskId, agentId, task.retryCount(), task.maxRetries(), delay.toMillis(), reason, cause);
        } else {
            graph.markFailed(taskId);
            log.warn("Task {} failed on agent {} with no retries left: {}", taskId, agentId, reason, cause);
        }
        publish(CoordinationEventType.TASK_FAILED, taskId, agentId,
                Map.of("reason", reason, "retrying", retrying, "retryCount", task.retryCount()));
        if (!retrying) {
            cancelDependentsOf(taskId);
        }
        return snapshotOf(failed);
    }

    // --- Cancellation ---

    /**
     * Cancels a task and every dependent that has not completed. Tasks already running are
     * not interrupted: they are flagged, and end CANCELLED when their agent reports back.
     *
     * @return ids cancelled or flagged for cancellation
     */
    public Set<String> cancel(String taskId) {
        Task task = state.tasks().require(taskId).value();
        if (task.status().terminal()) {
            return Set.of();
        }
        var affected = new LinkedHashSet<String>();
        for (String id : graph.markCancelled(taskId)) {
            if (cancelOne(id)) {
                affected.add(id);
            }
        }
        metrics.recordTaskCancelled(affected.size());
        log.info("Cancelled {} (affected: {})", taskId, affected);
        return affected;
    }

    public boolean isCancellationRequested(String taskId) {
        return cancelRequested.contains(taskId);
    }

    /**
     * Called by an agent that observed a cancellation request: the running task ends
     * CANCELLED, its resources are released and the agent's load drops.
     */
    public TaskStatusSnapshot acknowledgeCancellation(String taskId) {
        Versioned<Task> current = state.tasks().require(taskId);
        if (!cancelRequested.remove(taskId)) {
            return snapshotOf(current);
        }
        String agentId = current.value().assignedAgentId();
        Versioned<Task> cancelled = state.tasks().update(taskId, t -> t.cancel(CANCEL_REASON),
                CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        resources.release(taskId);
        updateAgent(agentId, a -> a.withLoad(a.load() - 1, clock.instant()));
        publish(CoordinationEventType.TASK_CANCELLED, taskId, agentId, Map.of("cooperative", true));
        log.info("Task {} stopped on agent {} after cancellation", taskId, agentId);
        return snapshotOf(cancelled);
    }

    // --- Backend execution ---

    /**
     * Runs an assigned task end to end: start, invoke the backend, then complete or fail.
     *
     * The outcome is recorded against the attempt started here only. If the attempt timed out
     * or its agent was removed while the backend call was in flight, the late outcome is
     * discarded and leaves the task's current attempt untouched.
     *
     * @return the backend result, or empty if the task failed, was cancelled or the attempt went stale
     * @throws IllegalStateException if the task is not ASSIGNED to {@code agentId}
     */
    public Optional<String> execute(String taskId, String agentId, String endpoint, String payload) {
        MdcContext.setTask(taskId, agentId);
        MdcContext.setEndpoint(endpoint);
        try {
            int attempt = startTask(taskId, agentId).retryCount();
            String result;
            try {
                result = backend.invoke(endpoint, payload);
            } catch (RuntimeException e) {
                failTask(taskId, agentId, attempt, e);
                return Optional.empty();
            }
            TaskStatusSnapshot outcome = completeTask(taskId, agentId, attempt);
            return outcome.status() == TaskStatus.COMPLETED ? Optional.of(result) : Optional.empty();
        } catch (StaleAttemptException e) {
            log.info("Discarding late outcome: {}", e.getMessage());
            return Optional.empty();
        } finally {
            MdcContext.clear();
        }
    }

    // --- Queries ---

    public Optional<TaskStatusSnapshot> getStatus(String taskId) {
        return state.tasks().read(taskId).map(this::snapshotOf);
    }

    public MetricsSample getMetricsSnapshot() {
        return collector.snapshot();
    }

    /**
     * True when the task will make no further progress: completed, cancelled, or failed
     * with no retry pending.
     */
    public boolean isSettled(String taskId) {
        return state.task(taskId).map(this::settled).orElse(true);
    }

    public boolean allSettled() {
        return state.taskList().stream().allMatch(this::settled);
    }

    public CoordinationState state() {
        return state;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public AdvancedTaskScheduler scheduler() {
        return scheduler;
    }

    // --- Recovery ---

    /**
     * Reloads checkpointed agents and tasks not already known. In-flight work from the
     * previous process is lost, so recovered agents start with no load and recovered
     * unfinished tasks start again from PENDING.
     *
     * @return number of tasks recovered
     */
    public int recover() {
        Instant now = clock.instant();
        for (Versioned<Agent> saved : checkpoints.loadAgents()) {
            Agent agent = saved.value();
            if (state.agent(agent.id()).isPresent() || agent.status() == AgentStatus.OFFLINE) {
                continue;
            }
            Agent fresh = agent.withLoad(0, now);
            state.agents().restore(new Versioned<>(agent.id(), fresh, saved.version(), now));
        }

        var recovered = new ArrayList<Task>();
        for (Versioned<Task> saved : checkpoints.loadTasks()) {
            Task task = saved.value();
            if (state.task(task.id()).isPresent()) {
                continue;
            }
            Task restored = settledStatus(task) ? task : task.resetForRecovery();
            state.tasks().restore(new Versioned<>(task.id(), restored, saved.version(), now));
            recovered.add(restored);
        }
        for (Task task : recovered) {
            try {
                graph.addTask(task.id(), task.dependencies());
            } catch (CoordinationException | IllegalArgumentException e) {
                log.warn("Skipping recovered task {}: {}", task.id(), e.getMessage());
            }
        }
        for (Task task : recovered) {
            if (!graph.contains(task.id())) {
                continue;
            }
            switch (task.status()) {
                case COMPLETED -> graph.markCompleted(task.id());
                case CANCELLED -> graph.markCancelled(task.id());
                case FAILED -> graph.markFailed(task.id());
                default -> {
                }
            }
        }
        if (!recovered.isEmpty()) {
            log.info("Recovered {} task(s) and {} agent(s) from checkpoints", recovered.size(), state.agents().size());
        }
        return recovered.size();
    }

    // --- internals ---

    private void promoteReady(Collection<String> candidates) {
        for (String id : candidates) {
            synchronized (graph) {
                if (!graph.isReady(id)) {
                    continue;
                }
                graph.markDispatched(id);
            }
            try {
                Versioned<Task> ready = state.tasks().update(id, t -> {
                    requireStatus(t, TaskStatus.PENDING);
                    return t.withStatus(TaskStatus.READY);
                }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
                scheduler.enqueue(ready.value());
            } catch (IllegalStateException | VersionConflictException | NoSuchElementException e) {
                log.debug("Task {} not promoted: {}", id, e.getMessage());
            }
        }
    }

    private void requeueDueRetries() {
        Instant now = clock.instant();
        for (var entry : retryAt.entrySet()) {
            if (entry.getValue().isAfter(now) || !retryAt.remove(entry.getKey(), entry.getValue())) {
                continue;
            }
            String id = entry.getKey();
            try {
                Versioned<Task> retried = state.tasks().update(id, t -> {
                    requireStatus(t, TaskStatus.FAILED);
                    return t.retry();
                }, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
                scheduler.enqueue(retried.value());
                log.info("Retrying task {} (attempt {}/{})", id, retried.value().retryCount() + 1,
                        retried.value().maxRetries() + 1);
            } catch (IllegalStateException | VersionConflictException | NoSuchElementException e) {
                log.debug("Retry of {} dropped: {}", id, e.getMessage());
            }
        }
    }

    private boolean cancelOne(String id) {
        for (int attempt = 0; attempt < CoordinationState.DEFAULT_UPDATE_ATTEMPTS; attempt++) {
            Optional<Versioned<Task>> read = state.tasks().read(id);
            if (read.isEmpty()) {
                return false;
            }
            Task task = read.get().value();
            if (task.status().terminal()) {
                return false;
            }
            if (task.status() == TaskStatus.RUNNING) {
                cancelRequested.add(id);
                log.info("Task {} is running on agent {}; cancellation requested", id, task.assignedAgentId());
                return true;
            }
            try {
                state.tasks().tryUpdate(id, read.get().version(), t -> t.cancel(CANCEL_REASON));
            } catch (VersionConflictException e) {
                continue;
            }
            scheduler.forget(id);
            retryAt.remove(id);
            if (task.status() == TaskStatus.ASSIGNED) {
                resources.release(id);
                updateAgent(task.assignedAgentId(), a -> a.withLoad(a.load() - 1, clock.instant()));
            }
            publish(CoordinationEventType.TASK_CANCELLED, id, task.assignedAgentId(),
                    Map.of("previousStatus", task.status().name()));
            return true;
        }
        log.warn("Gave up cancelling {} after repeated conflicts", id);
        return false;
    }

    private void cancelDependentsOf(String taskId) {
        Set<String> dependents = graph.cancelDependents(taskId);
        int cancelled = 0;
        for (String id : dependents) {
            if (cancelOne(id)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            metrics.recordTaskCancelled(cancelled);
            log.info("Cancelled {} dependent(s) of failed task {}", cancelled, taskId);
        }
    }

    private void updateAgent(String agentId, UnaryOperator<Agent> mutation) {
        if (agentId == null || state.agent(agentId).isEmpty()) {
            return;
        }
        try {
            state.agents().update(agentId, mutation, CoordinationState.DEFAULT_UPDATE_ATTEMPTS);
        } catch (NoSuchElementException e) {
            log.debug("Agent {} left before its bookkeeping was updated", agentId);
        }
    }

    private boolean settled(Task task) {
        return switch (task.status()) {
            case COMPLETED, CANCELLED -> true;
            case FAILED -> !retryAt.containsKey(task.id());
            default -> false;
        };
    }

    private static boolean settledStatus(Task task) {
        return task.status().terminal() || (task.status() == TaskStatus.FAILED && !task.retriesLeft());
    }

    private boolean cannotComplete(String dependencyId) {
        if (!graph.contains(dependencyId)) {
            return false;
        }
        DependencyGraph.NodeState node = graph.stateOf(dependencyId);
        return node == DependencyGraph.NodeState.FAILED || node == DependencyGraph.NodeState.CANCELLED;
    }

    private static void requireAttempt(Task task, String agentId, int attempt, Set<TaskStatus> live) {
        if (!live.contains(task.status()) || !Objects.equals(agentId, task.assignedAgentId())
                || task.retryCount() != attempt) {
            throw new StaleAttemptException(task.id(), agentId, attempt,
                    task.status() + " on " + task.assignedAgentId() + " at attempt " + task.retryCount());
        }
    }

    private static void requireStatus(Task task, TaskStatus expected) {
        if (task.status() != expected) {
            throw new IllegalStateException("Task " + task.id() + " is " + task.status() + ", expected " + expected);
        }
    }

    private static String failureKind(Throwable cause) {
        if (cause instanceof TaskTimeoutException) {
            return "timeout";
        }
        if (cause instanceof CoordinationException) {
            return "coordination";
        }
        return "backend";
    }

    private TaskStatusSnapshot snapshotOf(Versioned<Task> versioned) {
        Task task = versioned.value();
        return new TaskStatusSnapshot(task.id(), task.status(), task.assignedAgentId(), task.retryCount(),
                versioned.version(), task.failureReason(), cancelRequested.contains(task.id()), versioned.updatedAt());
    }

    private void publish(CoordinationEventType type, String taskId, String agentId, Map<String, Object> payload) {
        router.publish(CoordinationEvent.of(type, taskId, agentId, payload, clock.instant()));
    }

    private void checkpoint(CoordinationEvent event) {
        if (event.type() == CoordinationEventType.AGENT_REMOVED) {
            checkpoints.deleteAgent(event.agentId());
            return;
        }
        if (event.taskId() != null) {
            state.tasks().read(event.taskId()).ifPresent(checkpoints::saveTask);
        }
        if (event.agentId() != null) {
            state.agents().read(event.agentId()).ifPresent(checkpoints::saveAgent);
        }
        Object from = event.payload().get("from");
        if (from instanceof String donor) {
            state.agents().read(donor).ifPresent(checkpoints::saveAgent);
        }
    }

    private void runCycleSafely() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.warn("Scheduling cycle failed: {}", e.getMessage(), e);
        }
    }
}
