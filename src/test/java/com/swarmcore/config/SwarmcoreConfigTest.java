package com.swarmcore.config;

import com.swarmcore.core.conflict.ConflictResolver;
import com.swarmcore.core.engine.CoordinationManager;
import com.swarmcore.core.engine.CoordinationSettings;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.resources.ResourceManager;
import com.swarmcore.core.scheduler.AdvancedTaskScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SwarmcoreConfigTest {

    @Configuration
    @EnableConfigurationProperties(SwarmcoreProperties.class)
    @Import({SwarmcoreConfig.class, SwarmMetrics.class})
    static class EngineConfiguration {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(EngineConfiguration.class);

    @Test
    @DisplayName("defaults wire the capability scheduler and priority conflict resolution")
    void defaults() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals("capability", context.getBean(AdvancedTaskScheduler.class).strategy().name());
            assertEquals("priority", context.getBean(ConflictResolver.class).strategyName());

            CoordinationSettings settings = context.getBean(CoordinationSettings.class);
            assertEquals(Duration.ofMillis(250), settings.cycleInterval());
            assertTrue(settings.stealingEnabled());
            assertFalse(context.getBean(CoordinationManager.class).isRunning());
        });
    }

    @Test
    @DisplayName("properties select strategies and register resources")
    void boundProperties() {
        contextRunner
                .withPropertyValues(
                        "swarmcore.scheduler.strategy=least-loaded",
                        "swarmcore.scheduler.cycle-interval=50ms",
                        "swarmcore.conflict.strategy=voting",
                        "swarmcore.conflict.observers=auditor",
                        "swarmcore.resources.gpu.capacity=1",
                        "swarmcore.resources.gpu.exclusive=true",
                        "swarmcore.resources.cpu.capacity=16")
                .run(context -> {
                    assertEquals("least-loaded", context.getBean(AdvancedTaskScheduler.class).strategy().name());
                    assertEquals("voting", context.getBean(ConflictResolver.class).strategyName());
                    assertEquals(Duration.ofMillis(50), context.getBean(CoordinationSettings.class).cycleInterval());

                    ResourceManager resources = context.getBean(ResourceManager.class);
                    assertTrue(resources.isExclusive("gpu"));
                    assertEquals(16, resources.availability("cpu"));
                });
    }

    @Test
    @DisplayName("unknown conflict strategy fails startup")
    void unknownConflictStrategy() {
        contextRunner
                .withPropertyValues("swarmcore.conflict.strategy=coin-flip")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("unknown scheduling strategy fails startup")
    void unknownSchedulingStrategy() {
        contextRunner
                .withPropertyValues("swarmcore.scheduler.strategy=random")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }
}
