package com.swarmcore.core.metrics;

import com.swarmcore.core.conflict.ConflictResolver;
import com.swarmcore.core.events.CoordinationEvent;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.resilience.CircuitBreakerManager;
import com.swarmcore.core.resilience.CircuitBreakerMetrics;
import com.swarmcore.core.scheduler.TaskScheduler;
import com.swarmcore.core.state.CoordinationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples the coordinator periodically into a bounded ring.
 * <p>
 * Event-derived counters (assignments, steals, completions, failures) come from a
 * {@link MessageRouter} subscription; everything else is read from the components at
 * sample time.
 */
public class CoordinationMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(CoordinationMetricsCollector.class);

    private final CoordinationState state;
    private final TaskScheduler scheduler;
    private final CircuitBreakerManager breakers;
    private final ConnectionPool pool;
    private final ConflictResolver resolver;
    private final Clock clock;
    private final SampleRing<MetricsSample> ring;
    private final Instant createdAt;
    private final MessageRouter.Subscription subscription;

    private final AtomicLong assignments = new AtomicLong();
    private final AtomicLong steals = new AtomicLong();
    private final AtomicLong completions = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    private ScheduledExecutorService executor;

    public CoordinationMetricsCollector(CoordinationState state,
                                        TaskScheduler scheduler,
                                        CircuitBreakerManager breakers,
                                        ConnectionPool pool,
                                        ConflictResolver resolver,
                                        MessageRouter router,
                                        SwarmMetrics metrics,
                                        int retention,
                                        Clock clock) {
        this.state = state;
        this.scheduler = scheduler;
        this.breakers = breakers;
        this.pool = pool;
        this.resolver = resolver;
        this.clock = clock;
        this.ring = new SampleRing<>(retention);
        this.createdAt = clock.instant();
        this.subscription = router.subscribe("metrics-collector", Set.of(), this::count);
        metrics.gauge("swarmcore.scheduler.queue_depth", scheduler, TaskScheduler::queueDepth);
        metrics.gauge("swarmcore.pool.in_use", pool, p -> p.stats().inUse());
        metrics.gauge("swarmcore.pool.utilization", pool, p -> p.stats().utilization());
    }

    public synchronized void start(Duration interval) {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-sampler");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        executor.scheduleAtFixedRate(this::sampleSafely, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Metrics sampling started (interval={}, retention={})", interval, ring.capacity());
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
        log.info("Metrics sampling stopped");
    }

    /**
     * Stops sampling and the event subscription.
     */
    public void close() {
        stop();
        subscription.unsubscribe();
    }

    /**
     * Takes a sample now and appends it to the ring.
     */
    public MetricsSample sample() {
        MetricsSample sample = snapshot();
        ring.add(sample);
        return sample;
    }

    /**
     * Observes the coordinator now without recording the observation.
     */
    public MetricsSample snapshot() {
        var loads = new LinkedHashMap<String, Integer>();
        for (Agent agent : state.agentList()) {
            loads.put(agent.id(), agent.load());
        }
        var endpoints = new ArrayList<EndpointSample>();
        for (CircuitBreakerMetrics m : breakers.getAllMetrics()) {
            endpoints.add(new EndpointSample(m.endpoint(), m.state(), m.consecutiveFailures(), m.failureRate()));
        }
        long assigned = assignments.get();
        long conflicts = resolver.conflictCount() + state.conflictCount();
        return new MetricsSample(
                clock.instant(),
                scheduler.queueDepth(),
                loads,
                endpoints,
                pool.stats().utilization(),
                assigned == 0 ? 0.0 : (double) conflicts / assigned,
                assigned == 0 ? 0.0 : (double) steals.get() / assigned,
                summary());
    }

    public Optional<MetricsSample> latest() {
        return ring.latest();
    }

    public List<MetricsSample> history() {
        return ring.toList();
    }

    public CoordinationSummary summary() {
        List<Agent> agents = state.agentList();
        List<Task> tasks = state.taskList();
        long completedRuns = agents.stream().mapToLong(Agent::tasksCompleted).sum();
        long totalMs = agents.stream().mapToLong(Agent::totalExecutionMs).sum();
        long done = completions.get();
        long failed = failures.get();
        double minutes = Math.max(1, Duration.between(createdAt, clock.instant()).toMillis()) / 60_000.0;
        return new CoordinationSummary(
                agents.size(),
                (int) agents.stream().filter(a -> a.load() > 0).count(),
                tasks.size(),
                (int) tasks.stream().filter(t -> t.status() == TaskStatus.COMPLETED).count(),
                (int) tasks.stream().filter(t -> t.status() == TaskStatus.FAILED).count(),
                completedRuns == 0 ? 0.0 : (double) totalMs / completedRuns,
                done / minutes,
                done + failed == 0 ? 0.0 : (double) failed / (done + failed));
    }

    private void count(CoordinationEvent event) {
        switch (event.type()) {
            case TASK_ASSIGNED -> assignments.incrementAndGet();
            case TASK_STOLEN -> steals.incrementAndGet();
            case TASK_COMPLETED -> completions.incrementAndGet();
            case TASK_FAILED -> failures.incrementAndGet();
            default -> {
            }
        }
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            log.warn("Metrics sample failed: {}", e.getMessage(), e);
        }
    }
}
