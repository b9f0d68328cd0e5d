package com.swarmcore.core.stealing;

import com.swarmcore.MutableClock;
import com.swarmcore.core.events.CoordinationEvent;
import com.swarmcore.core.events.CoordinationEventType;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.ResourceRequirements;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.resources.ResourceManager;
import com.swarmcore.core.state.CoordinationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class WorkStealingCoordinatorTest {

    private MutableClock clock;
    private CoordinationState state;
    private ResourceManager resources;
    private MessageRouter router;
    private SimpleMeterRegistry registry;
    private List<CoordinationEvent> stolen;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        state = new CoordinationState(clock);
        resources = new ResourceManager();
        router = new MessageRouter(64);
        registry = new SimpleMeterRegistry();
        stolen = new CopyOnWriteArrayList<>();
        router.subscribe("test", Set.of(CoordinationEventType.TASK_STOLEN), stolen::add);
    }

    @AfterEach
    void tearDown() {
        router.shutdown(Duration.ofSeconds(1));
    }

    private WorkStealingCoordinator coordinator(double threshold, int maxSteals) {
        return new WorkStealingCoordinator(state, resources, router, new SwarmMetrics(registry),
                threshold, maxSteals, clock);
    }

    private void agent(String id, int load, String... capabilities) {
        state.agents().register(id, Agent.of(id, 8, capabilities).withLoad(load, clock.instant()));
    }

    private void assigned(String taskId, String agentId, boolean running, String... capabilities) {
        clock.advance(Duration.ofSeconds(1));
        Task task = Task.builder(taskId).requires(capabilities).build()
                .withStatus(TaskStatus.READY)
                .assignTo(agentId, clock.instant());
        if (running) {
            task = task.start(clock.instant());
        }
        state.tasks().register(taskId, task);
        resources.claim(taskId, ResourceRequirements.none());
    }

    @Test
    @DisplayName("moves unstarted work from an overloaded agent to an idle one")
    void movesUnstartedWork() {
        agent("busy", 4);
        agent("idle", 0);
        for (int i = 1; i <= 4; i++) {
            assigned("t" + i, "busy", false);
        }

        int migrated = coordinator(0.5, 8).rebalance();

        assertEquals(2, migrated);
        assertEquals(2, state.agent("busy").orElseThrow().load());
        assertEquals(2, state.agent("idle").orElseThrow().load());
        // Most recently assigned tasks move first
        assertEquals("idle", state.task("t4").orElseThrow().assignedAgentId());
        assertEquals("idle", state.task("t3").orElseThrow().assignedAgentId());
        assertEquals("busy", state.task("t1").orElseThrow().assignedAgentId());
        assertEquals(TaskStatus.ASSIGNED, state.task("t4").orElseThrow().status());
        assertEquals(2.0, registry.find("swarmcore.stealing.migrations").counter().count());

        assertTrue(router.flush(Duration.ofSeconds(1)));
        assertEquals(2, stolen.size());
        assertEquals("busy", stolen.get(0).payload().get("from"));
    }

    @Test
    @DisplayName("running tasks are never migrated")
    void runningNeverMigrated() {
        agent("busy", 4);
        agent("idle", 0);
        for (int i = 1; i <= 4; i++) {
            assigned("t" + i, "busy", true);
        }

        assertEquals(0, coordinator(0.5, 8).rebalance());
        for (int i = 1; i <= 4; i++) {
            Task task = state.task("t" + i).orElseThrow();
            assertEquals("busy", task.assignedAgentId());
            assertEquals(TaskStatus.RUNNING, task.status());
        }
    }

    @Test
    @DisplayName("tasks the receiver cannot handle stay put")
    void capabilityRespected() {
        agent("busy", 4, "gpu");
        agent("idle", 0);
        for (int i = 1; i <= 4; i++) {
            assigned("t" + i, "busy", false, "gpu");
        }

        assertEquals(0, coordinator(0.5, 8).rebalance());
    }

    @Test
    @DisplayName("balanced agents within the threshold are left alone")
    void withinThreshold() {
        agent("a", 2);
        agent("b", 1);
        assigned("t1", "a", false);
        assigned("t2", "a", false);

        assertEquals(0, coordinator(1.0, 8).rebalance());
    }

    @Test
    @DisplayName("steals per pass are capped")
    void capped() {
        agent("busy", 6);
        agent("idle", 0);
        for (int i = 1; i <= 6; i++) {
            assigned("t" + i, "busy", false);
        }

        assertEquals(1, coordinator(0.5, 1).rebalance());
    }

    @Test
    @DisplayName("workloads report unstarted and running counts with deviation from the mean")
    void workloads() {
        agent("a", 2);
        agent("b", 0);
        assigned("t1", "a", false);
        assigned("t2", "a", true);

        var byId = coordinator(1.0, 8).workloads();
        AgentWorkload a = byId.get(0);
        assertEquals("a", a.agentId());
        assertEquals(1, a.unstarted());
        assertEquals(1, a.running());
        assertEquals(1.0, a.deviation(), 1e-9);
    }
}
