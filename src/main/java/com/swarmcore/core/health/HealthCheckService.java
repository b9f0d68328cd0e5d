package com.swarmcore.core.health;

import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.graph.DependencyGraph;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.pool.PoolStats;
import com.swarmcore.core.resilience.CircuitBreakerManager;
import com.swarmcore.core.resilience.CircuitBreakerMetrics;
import com.swarmcore.core.resilience.CircuitState;
import com.swarmcore.core.state.CoordinationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DependencyGraph graph;
    private final ConnectionPool pool;
    private final CircuitBreakerManager breakers;
    private final MessageRouter router;
    private final CoordinationState state;

    public HealthCheckService(DependencyGraph graph,
                              ConnectionPool pool,
                              CircuitBreakerManager breakers,
                              MessageRouter router,
                              CoordinationState state) {
        this.graph = graph;
        this.pool = pool;
        this.breakers = breakers;
        this.router = router;
        this.state = state;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkPool());
        results.add(checkBreakers());
        results.add(checkRouter());
        results.add(checkAgents());
        return results;
    }

    private HealthStatus checkGraph() {
        try {
            int ordered = graph.topologicalOrder().size();
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    ordered + " task(s), acyclic", Map.of("tasks", String.valueOf(ordered)));
        } catch (RuntimeException e) {
            log.warn("Graph health check failed: {}", e.getMessage());
            return new HealthStatus("graph", HealthStatus.Status.DOWN,
                    "Graph error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkPool() {
        PoolStats stats = pool.stats();
        Map<String, String> metadata = Map.of(
                "inUse", String.valueOf(stats.inUse()),
                "idle", String.valueOf(stats.idle()),
                "waiting", String.valueOf(stats.waiting()));
        if (stats.draining()) {
            return new HealthStatus("pool", HealthStatus.Status.DOWN, "Pool is draining", metadata);
        }
        if (stats.waiting() > 0) {
            return new HealthStatus("pool", HealthStatus.Status.DEGRADED,
                    stats.waiting() + " caller(s) waiting for a connection", metadata);
        }
        return new HealthStatus("pool", HealthStatus.Status.UP,
                String.format("%d/%d connections in use", stats.inUse(), stats.maxSize()), metadata);
    }

    private HealthStatus checkBreakers() {
        List<CircuitBreakerMetrics> all = breakers.getAllMetrics();
        List<String> open = all.stream()
                .filter(m -> m.state() != CircuitState.CLOSED)
                .map(m -> m.endpoint() + "=" + m.state())
                .toList();
        if (!open.isEmpty()) {
            return new HealthStatus("breakers", HealthStatus.Status.DEGRADED,
                    "Not closed: " + String.join(", ", open), Map.of("endpoints", String.valueOf(all.size())));
        }
        return new HealthStatus("breakers", HealthStatus.Status.UP,
                all.size() + " endpoint(s), all closed", Map.of("endpoints", String.valueOf(all.size())));
    }

    private HealthStatus checkRouter() {
        long dropped = router.totalDropped();
        Map<String, String> metadata = Map.of(
                "subscribers", String.valueOf(router.subscriberCount()),
                "dropped", String.valueOf(dropped));
        if (dropped > 0) {
            return new HealthStatus("router", HealthStatus.Status.DEGRADED,
                    dropped + " event(s) dropped by slow subscribers", metadata);
        }
        return new HealthStatus("router", HealthStatus.Status.UP,
                router.subscriberCount() + " subscriber(s)", metadata);
    }

    private HealthStatus checkAgents() {
        int total = state.agents().size();
        long accepting = state.agentList().stream().filter(a -> a.accepting()).count();
        Map<String, String> metadata = Map.of("total", String.valueOf(total), "accepting", String.valueOf(accepting));
        if (total == 0) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED, "No agents registered", metadata);
        }
        return new HealthStatus("agents", HealthStatus.Status.UP,
                accepting + "/" + total + " agent(s) accepting work", metadata);
    }
}
