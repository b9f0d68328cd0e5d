package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.AgentStatus;
import com.swarmcore.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingStrategyTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private AffinityTracker affinity;

    @BeforeEach
    void setUp() {
        affinity = new AffinityTracker();
    }

    private SchedulingContext context(Agent... agents) {
        return new SchedulingContext(List.of(agents), affinity);
    }

    private static Agent loaded(Agent agent, int load) {
        return agent.withLoad(load, T0);
    }

    // -- Capability ------------------------------------------------------------

    @Nested
    @DisplayName("capability")
    class CapabilityTests {

        private final SchedulingStrategy strategy = new CapabilitySchedulingStrategy();

        @Test
        @DisplayName("only an agent with the required capability is chosen, even if busier")
        void requiredCapabilityWins() {
            Agent agent1 = Agent.of("agent-1", 4, "python");
            Agent agent2 = loaded(Agent.of("agent-2", 4, "python", "gpu"), 2);
            Task task = Task.builder("train").requires("gpu").build();

            assertEquals("agent-2", strategy.selectAgent(task, context(agent1, agent2)).id());
        }

        @Test
        @DisplayName("among equal loads prefers the agent with fewest surplus capabilities")
        void fewestSurplus() {
            Agent generalist = Agent.of("a-general", 4, "python", "gpu", "rust");
            Agent specialist = Agent.of("b-special", 4, "python");
            Task task = Task.builder("t").requires("python").build();

            assertEquals("b-special", strategy.selectAgent(task, context(generalist, specialist)).id());
        }

        @Test
        @DisplayName("no capable agent raises NoCapableAgentException")
        void noCapableAgent() {
            Task task = Task.builder("t").requires("fpga").build();
            var ex = assertThrows(NoCapableAgentException.class,
                    () -> strategy.selectAgent(task, context(Agent.of("a", 1, "python"))));
            assertEquals("t", ex.getTaskId());
        }

        @Test
        @DisplayName("agents at capacity or offline are not eligible")
        void saturatedAndOfflineSkipped() {
            Agent full = loaded(Agent.of("a", 1, "python"), 1);
            Agent offline = Agent.of("b", 4, "python").withStatus(AgentStatus.OFFLINE);
            Task task = Task.builder("t").requires("python").build();

            assertThrows(NoCapableAgentException.class, () -> strategy.selectAgent(task, context(full, offline)));
        }
    }

    // -- Round robin and least loaded -----------------------------------------

    @Nested
    @DisplayName("round-robin and least-loaded")
    class RotationTests {

        @Test
        @DisplayName("round-robin cycles through eligible agents")
        void roundRobin() {
            var strategy = new RoundRobinSchedulingStrategy();
            var ctx = context(Agent.of("a", 4), Agent.of("b", 4), Agent.of("c", 4));
            Task task = Task.builder("t").build();

            assertEquals("a", strategy.selectAgent(task, ctx).id());
            assertEquals("b", strategy.selectAgent(task, ctx).id());
            assertEquals("c", strategy.selectAgent(task, ctx).id());
            assertEquals("a", strategy.selectAgent(task, ctx).id());
        }

        @Test
        @DisplayName("least-loaded picks the lowest load, then the lowest id")
        void leastLoaded() {
            var strategy = new LeastLoadedSchedulingStrategy();
            Task task = Task.builder("t").build();

            assertEquals("b", strategy.selectAgent(task,
                    context(loaded(Agent.of("a", 4), 2), loaded(Agent.of("b", 4), 1))).id());
            assertEquals("a", strategy.selectAgent(task,
                    context(loaded(Agent.of("b", 4), 1), loaded(Agent.of("a", 4), 1))).id());
        }
    }

    // -- Affinity --------------------------------------------------------------

    @Nested
    @DisplayName("affinity")
    class AffinityTests {

        private final SchedulingStrategy strategy = new AffinitySchedulingStrategy();

        @Test
        @DisplayName("prefers the agent that last completed work in the same namespace")
        void prefersRecentNamespace() {
            affinity.record("b", Task.builder("old").tags("repo:alpha").build(), T0);
            Task task = Task.builder("t").tags("repo:alpha").build();

            Agent a = Agent.of("a", 4);
            Agent b = loaded(Agent.of("b", 4), 2);
            assertEquals("b", strategy.selectAgent(task, context(a, b)).id());
        }

        @Test
        @DisplayName("falls back to least-loaded without history")
        void fallback() {
            Task task = Task.builder("t").tags("repo:beta").build();
            Agent a = loaded(Agent.of("a", 4), 3);
            Agent b = Agent.of("b", 4);
            assertEquals("b", strategy.selectAgent(task, context(a, b)).id());
        }

        @Test
        @DisplayName("forgotten agents lose their affinity")
        void forget() {
            Task task = Task.builder("t").tags("repo:alpha").build();
            affinity.record("a", task, T0);
            affinity.forget("a");
            assertTrue(affinity.preferred(task, List.of(Agent.of("a", 1))).isEmpty());
        }
    }

    // -- Factory ---------------------------------------------------------------

    @Test
    @DisplayName("factory parses dashed and enum names")
    void factory() {
        assertEquals("round-robin", SchedulingStrategyFactory.create("round-robin").name());
        assertEquals("least-loaded", SchedulingStrategyFactory.create("LEAST_LOADED").name());
        assertEquals("affinity", SchedulingStrategyFactory.create(SchedulingStrategyFactory.StrategyType.AFFINITY).name());
        assertThrows(IllegalArgumentException.class, () -> SchedulingStrategyFactory.create("random"));
    }
}
