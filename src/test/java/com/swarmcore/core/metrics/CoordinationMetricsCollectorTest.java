package com.swarmcore.core.metrics;

import com.swarmcore.MutableClock;
import com.swarmcore.backend.BackendException;
import com.swarmcore.backend.LoopbackConnectionFactory;
import com.swarmcore.core.conflict.ConflictResolver;
import com.swarmcore.core.conflict.PriorityResolutionStrategy;
import com.swarmcore.core.events.CoordinationEvent;
import com.swarmcore.core.events.CoordinationEventType;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.resilience.CircuitBreakerManager;
import com.swarmcore.core.resilience.CircuitState;
import com.swarmcore.core.scheduler.TaskScheduler;
import com.swarmcore.core.state.CoordinationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationMetricsCollectorTest {

    private MutableClock clock;
    private CoordinationState state;
    private TaskScheduler scheduler;
    private CircuitBreakerManager breakers;
    private ConnectionPool pool;
    private MessageRouter router;
    private SimpleMeterRegistry registry;
    private CoordinationMetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        state = new CoordinationState(clock);
        scheduler = new TaskScheduler(clock);
        breakers = new CircuitBreakerManager(1, Duration.ofSeconds(30), clock);
        pool = new ConnectionPool(new LoopbackConnectionFactory(), 4, Duration.ofMinutes(1), Duration.ofSeconds(1), clock);
        router = new MessageRouter(64);
        registry = new SimpleMeterRegistry();
        collector = new CoordinationMetricsCollector(state, scheduler, breakers, pool,
                new ConflictResolver(new PriorityResolutionStrategy(), clock, 16), router,
                new SwarmMetrics(registry), 2, clock);
    }

    @AfterEach
    void tearDown() {
        collector.close();
        router.shutdown(Duration.ofSeconds(1));
    }

    private void publish(CoordinationEventType type, String taskId) {
        router.publish(CoordinationEvent.of(type, taskId, "a", Map.of(), clock.instant()));
    }

    @Test
    @DisplayName("snapshot reports queue depth, agent loads, endpoints and pool utilization")
    void snapshot() {
        state.agents().register("a", Agent.of("a", 4).withLoad(2, clock.instant()));
        state.agents().register("b", Agent.of("b", 4));
        scheduler.enqueue(Task.builder("t1").build());
        pool.acquire();
        assertThrows(BackendException.class, () -> breakers.execute("svc", () -> {
            throw new BackendException("svc", "down");
        }));

        MetricsSample sample = collector.snapshot();

        assertEquals(1, sample.queueDepth());
        assertEquals(Map.of("a", 2, "b", 0), sample.agentLoads());
        assertEquals(0.25, sample.poolUtilization(), 1e-9);
        assertEquals(CircuitState.OPEN, sample.endpoints().get(0).state());
        assertEquals(2, sample.summary().totalAgents());
        assertEquals(1, sample.summary().activeAgents());
        assertTrue(collector.history().isEmpty());
    }

    @Test
    @DisplayName("rates and error rate come from the event stream")
    void eventRates() {
        publish(CoordinationEventType.TASK_ASSIGNED, "t1");
        publish(CoordinationEventType.TASK_ASSIGNED, "t2");
        publish(CoordinationEventType.TASK_STOLEN, "t2");
        publish(CoordinationEventType.TASK_COMPLETED, "t1");
        publish(CoordinationEventType.TASK_FAILED, "t2");
        assertTrue(router.flush(Duration.ofSeconds(2)));

        MetricsSample sample = collector.snapshot();
        assertEquals(0.5, sample.stealRate(), 1e-9);
        assertEquals(0.0, sample.conflictRate(), 1e-9);
        assertEquals(0.5, sample.summary().errorRate(), 1e-9);
    }

    @Test
    @DisplayName("samples are retained up to the configured limit")
    void retention() {
        collector.sample();
        clock.advance(Duration.ofSeconds(1));
        collector.sample();
        clock.advance(Duration.ofSeconds(1));
        MetricsSample last = collector.sample();

        assertEquals(2, collector.history().size());
        assertEquals(last, collector.latest().orElseThrow());
    }

    @Test
    @DisplayName("gauges track the queue and the pool")
    void gauges() {
        scheduler.enqueue(Task.builder("t1").build());
        scheduler.enqueue(Task.builder("t2").build());
        assertEquals(2.0, registry.find("swarmcore.scheduler.queue_depth").gauge().value());
        pool.acquire();
        assertEquals(1.0, registry.find("swarmcore.pool.in_use").gauge().value());
    }
}
