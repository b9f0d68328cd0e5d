package com.swarmcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "swarmcore")
public class SwarmcoreProperties {

    private Scheduler scheduler = new Scheduler();
    private Stealing stealing = new Stealing();
    private Breaker breaker = new Breaker();
    private Pool pool = new Pool();
    private Conflict conflict = new Conflict();
    private Router router = new Router();
    private Metrics metrics = new Metrics();
    private Backend backend = new Backend();
    private Map<String, Resource> resources = new LinkedHashMap<>();

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Stealing getStealing() { return stealing; }
    public void setStealing(Stealing stealing) { this.stealing = stealing; }
    public Breaker getBreaker() { return breaker; }
    public void setBreaker(Breaker breaker) { this.breaker = breaker; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Conflict getConflict() { return conflict; }
    public void setConflict(Conflict conflict) { this.conflict = conflict; }
    public Router getRouter() { return router; }
    public void setRouter(Router router) { this.router = router; }
    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
    public Backend getBackend() { return backend; }
    public void setBackend(Backend backend) { this.backend = backend; }
    public Map<String, Resource> getResources() { return resources; }
    public void setResources(Map<String, Resource> resources) { this.resources = resources; }

    public static class Scheduler {
        private String strategy = "capability";
        private Duration cycleInterval = Duration.ofMillis(250);
        private Duration unassignableGracePeriod = Duration.ofSeconds(30);
        private Duration defaultTaskTimeout = Duration.ofMinutes(10);
        private int maxRetries = 3;
        private Duration retryBaseDelay = Duration.ofMillis(500);
        private Duration retryMaxDelay = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getCycleInterval() { return cycleInterval; }
        public void setCycleInterval(Duration cycleInterval) { this.cycleInterval = cycleInterval; }
        public Duration getUnassignableGracePeriod() { return unassignableGracePeriod; }
        public void setUnassignableGracePeriod(Duration unassignableGracePeriod) { this.unassignableGracePeriod = unassignableGracePeriod; }
        public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
        public void setDefaultTaskTimeout(Duration defaultTaskTimeout) { this.defaultTaskTimeout = defaultTaskTimeout; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getRetryBaseDelay() { return retryBaseDelay; }
        public void setRetryBaseDelay(Duration retryBaseDelay) { this.retryBaseDelay = retryBaseDelay; }
        public Duration getRetryMaxDelay() { return retryMaxDelay; }
        public void setRetryMaxDelay(Duration retryMaxDelay) { this.retryMaxDelay = retryMaxDelay; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }

    public static class Stealing {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(2);
        private double threshold = 1.0;
        private int maxStealsPerCycle = 8;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public int getMaxStealsPerCycle() { return maxStealsPerCycle; }
        public void setMaxStealsPerCycle(int maxStealsPerCycle) { this.maxStealsPerCycle = maxStealsPerCycle; }
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getCoolDown() { return coolDown; }
        public void setCoolDown(Duration coolDown) { this.coolDown = coolDown; }
    }

    public static class Pool {
        private int maxSize = 8;
        private Duration idleTimeout = Duration.ofMinutes(5);
        private Duration acquireTimeout = Duration.ofSeconds(10);
        private Duration sweepInterval = Duration.ofSeconds(30);

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
        public Duration getAcquireTimeout() { return acquireTimeout; }
        public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Conflict {
        private String strategy = "priority";
        private double quorumRatio = 0.5;
        private Set<String> observers = new LinkedHashSet<>();
        private int historySize = 256;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public double getQuorumRatio() { return quorumRatio; }
        public void setQuorumRatio(double quorumRatio) { this.quorumRatio = quorumRatio; }
        public Set<String> getObservers() { return observers; }
        public void setObservers(Set<String> observers) { this.observers = observers; }
        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
    }

    public static class Router {
        private int subscriberQueueCapacity = 1024;

        public int getSubscriberQueueCapacity() { return subscriberQueueCapacity; }
        public void setSubscriberQueueCapacity(int subscriberQueueCapacity) { this.subscriberQueueCapacity = subscriberQueueCapacity; }
    }

    public static class Metrics {
        private Duration sampleInterval = Duration.ofSeconds(5);
        private int retention = 720;

        public Duration getSampleInterval() { return sampleInterval; }
        public void setSampleInterval(Duration sampleInterval) { this.sampleInterval = sampleInterval; }
        public int getRetention() { return retention; }
        public void setRetention(int retention) { this.retention = retention; }
    }

    public static class Backend {
        private String provider = "loopback";
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    public static class Resource {
        private int capacity = 1;
        private boolean exclusive = false;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public boolean isExclusive() { return exclusive; }
        public void setExclusive(boolean exclusive) { this.exclusive = exclusive; }
    }
}
