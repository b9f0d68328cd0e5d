package com.swarmcore.config;

import com.swarmcore.backend.BackendClient;
import com.swarmcore.backend.ConnectionFactory;
import com.swarmcore.backend.LoopbackConnectionFactory;
import com.swarmcore.core.conflict.ConflictResolutionStrategy;
import com.swarmcore.core.conflict.ConflictResolver;
import com.swarmcore.core.conflict.PriorityResolutionStrategy;
import com.swarmcore.core.conflict.TimestampResolutionStrategy;
import com.swarmcore.core.conflict.VotingResolutionStrategy;
import com.swarmcore.core.engine.CoordinationManager;
import com.swarmcore.core.engine.CoordinationSettings;
import com.swarmcore.core.events.MessageRouter;
import com.swarmcore.core.graph.DependencyGraph;
import com.swarmcore.core.memory.CheckpointService;
import com.swarmcore.core.memory.InMemoryMemoryStore;
import com.swarmcore.core.memory.MemoryStore;
import com.swarmcore.core.metrics.CoordinationMetricsCollector;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.resilience.CircuitBreakerManager;
import com.swarmcore.core.resilience.RetryPolicy;
import com.swarmcore.core.resources.ResourceDefinition;
import com.swarmcore.core.resources.ResourceManager;
import com.swarmcore.core.scheduler.AdvancedTaskScheduler;
import com.swarmcore.core.scheduler.AffinityTracker;
import com.swarmcore.core.scheduler.SchedulingStrategyFactory;
import com.swarmcore.core.state.CoordinationState;
import com.swarmcore.core.stealing.WorkStealingCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

/**
 * Wires the coordination engine from {@link SwarmcoreProperties}.
 */
@Configuration
public class SwarmcoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public CoordinationState coordinationState(Clock clock) {
        return new CoordinationState(clock);
    }

    @Bean
    public DependencyGraph dependencyGraph() {
        return new DependencyGraph();
    }

    @Bean
    public ResourceManager resourceManager(SwarmcoreProperties properties) {
        var manager = new ResourceManager();
        properties.getResources().forEach((name, resource) ->
                manager.register(new ResourceDefinition(name, resource.getCapacity(), resource.isExclusive())));
        return manager;
    }

    @Bean
    public CircuitBreakerManager circuitBreakerManager(SwarmcoreProperties properties, Clock clock) {
        var breaker = properties.getBreaker();
        return new CircuitBreakerManager(breaker.getFailureThreshold(), breaker.getCoolDown(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "swarmcore.backend.provider", havingValue = "loopback", matchIfMissing = true)
    public ConnectionFactory loopbackConnectionFactory() {
        return new LoopbackConnectionFactory();
    }

    @Bean
    public ConnectionPool connectionPool(ConnectionFactory connectionFactory, SwarmcoreProperties properties, Clock clock) {
        var pool = properties.getPool();
        return new ConnectionPool(connectionFactory, pool.getMaxSize(), pool.getIdleTimeout(),
                pool.getAcquireTimeout(), clock);
    }

    @Bean
    public BackendClient backendClient(CircuitBreakerManager breakers, ConnectionPool pool,
                                       SwarmcoreProperties properties, SwarmMetrics metrics) {
        var backend = properties.getBackend();
        return new BackendClient(breakers, pool,
                RetryPolicy.exponential(backend.getMaxAttempts(), backend.getBaseDelay(), backend.getMaxDelay()),
                metrics);
    }

    @Bean
    public MessageRouter messageRouter(SwarmcoreProperties properties) {
        return new MessageRouter(properties.getRouter().getSubscriberQueueCapacity());
    }

    @Bean
    public ConflictResolver conflictResolver(SwarmcoreProperties properties, Clock clock) {
        var conflict = properties.getConflict();
        ConflictResolutionStrategy strategy = switch (conflict.getStrategy().toLowerCase(Locale.ROOT)) {
            case "priority" -> new PriorityResolutionStrategy();
            case "timestamp" -> new TimestampResolutionStrategy();
            case "voting" -> new VotingResolutionStrategy(conflict.getQuorumRatio(), conflict.getObservers());
            default -> throw new IllegalArgumentException("Unknown conflict strategy: " + conflict.getStrategy());
        };
        return new ConflictResolver(strategy, clock, conflict.getHistorySize());
    }

    @Bean
    public AdvancedTaskScheduler taskScheduler(CoordinationState state, ResourceManager resources,
                                               ConflictResolver resolver, MessageRouter router,
                                               SwarmMetrics metrics, SwarmcoreProperties properties, Clock clock) {
        var scheduler = properties.getScheduler();
        return new AdvancedTaskScheduler(
                SchedulingStrategyFactory.create(scheduler.getStrategy()),
                state, resources, resolver, router, metrics, new AffinityTracker(),
                scheduler.getUnassignableGracePeriod(), clock);
    }

    @Bean
    public WorkStealingCoordinator workStealingCoordinator(CoordinationState state, ResourceManager resources,
                                                           MessageRouter router, SwarmMetrics metrics,
                                                           SwarmcoreProperties properties, Clock clock) {
        var stealing = properties.getStealing();
        return new WorkStealingCoordinator(state, resources, router, metrics,
                stealing.getThreshold(), stealing.getMaxStealsPerCycle(), clock);
    }

    @Bean
    public CoordinationMetricsCollector coordinationMetricsCollector(CoordinationState state,
                                                                     AdvancedTaskScheduler scheduler,
                                                                     CircuitBreakerManager breakers,
                                                                     ConnectionPool pool,
                                                                     ConflictResolver resolver,
                                                                     MessageRouter router,
                                                                     SwarmMetrics metrics,
                                                                     SwarmcoreProperties properties,
                                                                     Clock clock) {
        return new CoordinationMetricsCollector(state, scheduler, breakers, pool, resolver, router, metrics,
                properties.getMetrics().getRetention(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryStore memoryStore(Clock clock) {
        return new InMemoryMemoryStore(clock);
    }

    @Bean
    public CheckpointService checkpointService(MemoryStore memoryStore) {
        return new CheckpointService(memoryStore);
    }

    @Bean
    public CoordinationSettings coordinationSettings(SwarmcoreProperties properties) {
        var scheduler = properties.getScheduler();
        var stealing = properties.getStealing();
        return new CoordinationSettings(
                scheduler.getCycleInterval(),
                scheduler.getDefaultTaskTimeout(),
                RetryPolicy.exponential(Integer.MAX_VALUE, scheduler.getRetryBaseDelay(), scheduler.getRetryMaxDelay()),
                stealing.isEnabled(),
                stealing.getInterval(),
                properties.getPool().getSweepInterval(),
                properties.getMetrics().getSampleInterval(),
                scheduler.getShutdownTimeout());
    }

    @Bean(destroyMethod = "shutdown")
    public CoordinationManager coordinationManager(CoordinationState state,
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
        return new CoordinationManager(state, graph, scheduler, stealing, resources, pool, router,
                collector, checkpoints, backend, metrics, settings);
    }
}
