package com.swarmcore.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.ToDoubleFunction;

/**
 * Centralised Micrometer metrics for task coordination.
 */
@Service
public class SwarmMetrics {

    private final MeterRegistry registry;

    public SwarmMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordAssignment(String strategy) {
        Counter.builder("swarmcore.scheduler.assignments")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    /**
     * Records an assignment attempt that left the task in the ready queue.
     *
     * @param reason "no_agent", "resources" or "conflict"
     */
    public void recordAssignmentFailure(String reason) {
        Counter.builder("swarmcore.scheduler.assignment_failures")
                .description("Assignment attempts deferred to a later cycle")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTaskCompleted(long executionMs) {
        Timer.builder("swarmcore.task.duration")
                .tag("outcome", "completed")
                .register(registry)
                .record(Duration.ofMillis(executionMs));
    }

    /**
     * @param reason "backend", "timeout", "coordination" or "unassignable"
     * @param retrying whether the task will be retried
     */
    public void recordTaskFailed(String reason, boolean retrying) {
        Counter.builder("swarmcore.task.failures")
                .tag("reason", reason)
                .tag("retrying", String.valueOf(retrying))
                .register(registry)
                .increment();
    }

    public void recordTaskCancelled(int count) {
        Counter.builder("swarmcore.task.cancellations")
                .register(registry)
                .increment(count);
    }

    public void recordSteal() {
        Counter.builder("swarmcore.stealing.migrations")
                .description("Assigned tasks moved from a donor to a receiver agent")
                .register(registry)
                .increment();
    }

    public void recordConflict(String subject) {
        Counter.builder("swarmcore.conflict.resolutions")
                .tag("subject", subject)
                .register(registry)
                .increment();
    }

    public void recordCircuitRejection(String endpoint) {
        Counter.builder("swarmcore.circuit.rejections")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void recordBackendCall(String endpoint, boolean success, long ms) {
        Timer.builder("swarmcore.backend.calls")
                .tag("endpoint", endpoint)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStealBatch(int migrated) {
        DistributionSummary.builder("swarmcore.stealing.batch_size")
                .description("Tasks migrated per rebalance pass")
                .register(registry)
                .record(migrated);
    }

    /**
     * Registers a gauge sampled from {@code source} on every scrape.
     */
    public <T> void gauge(String name, T source, ToDoubleFunction<T> value) {
        Gauge.builder(name, source, value).register(registry);
    }
}
