package com.swarmcore.dispatch.cli;

import com.swarmcore.config.SwarmcoreProperties;
import com.swarmcore.core.CoordinationException;
import com.swarmcore.core.engine.CoordinationManager;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.resources.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CLI command: swarmcore run &lt;plan.json&gt;
 * <p>
 * Loads a plan, registers its resources and agents, submits its tasks and runs every
 * assigned task against the backend until all tasks settle or the timeout passes.
 * Exits 0 when every task completed, 1 otherwise, 2 when the plan cannot be loaded.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task plan to completion")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    private static final long POLL_MILLIS = 50;

    @Parameters(index = "0", description = "Path to the JSON plan file")
    private Path planPath;

    @Option(names = {"--timeout", "-t"}, description = "Seconds to wait for all tasks to settle",
            defaultValue = "300")
    private long timeoutSeconds;

    @Option(names = {"--workers", "-w"}, description = "Concurrent task executions", defaultValue = "4")
    private int workers;

    private final CoordinationManager manager;
    private final ResourceManager resources;
    private final SwarmcoreProperties properties;

    public RunCommand(CoordinationManager manager, ResourceManager resources, SwarmcoreProperties properties) {
        this.manager = manager;
        this.resources = resources;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        PlanFile plan;
        try {
            plan = PlanFile.read(planPath);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read plan " + planPath + ": " + e.getMessage());
            return 2;
        }

        try {
            plan.resources().forEach(r -> resources.register(r.toDefinition()));
            plan.agents().forEach(a -> manager.registerAgent(a.toAgent()));
            manager.start();
            int defaultRetries = properties.getScheduler().getMaxRetries();
            for (PlanFile.TaskSpec spec : plan.tasks()) {
                manager.submit(spec.toTask(defaultRetries));
            }
        } catch (CoordinationException | IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error("Invalid plan: " + e.getMessage());
            return 2;
        }
        ConsoleOutput.info(String.format("Submitted %d tasks to %d agents",
                plan.tasks().size(), plan.agents().size()));

        Map<String, PlanFile.TaskSpec> specs = plan.tasks().stream()
                .collect(Collectors.toMap(PlanFile.TaskSpec::id, Function.identity()));
        boolean settled = drive(specs, Duration.ofSeconds(timeoutSeconds));

        ConsoleOutput.rule();
        boolean allCompleted = true;
        for (PlanFile.TaskSpec spec : plan.tasks()) {
            var snapshot = manager.getStatus(spec.id()).orElseThrow();
            ConsoleOutput.taskStatus(snapshot);
            allCompleted &= snapshot.status() == TaskStatus.COMPLETED;
        }
        ConsoleOutput.metrics(manager.getMetricsSnapshot());

        if (!settled) {
            ConsoleOutput.error("Timed out after " + timeoutSeconds + "s with unsettled tasks");
            return 1;
        }
        if (allCompleted) {
            ConsoleOutput.success("All tasks completed");
            return 0;
        }
        ConsoleOutput.error("One or more tasks failed or were cancelled");
        return 1;
    }

    /**
     * Dispatches each assignment once per retry attempt until every task settles.
     *
     * @return false if the timeout passed first
     */
    private boolean drive(Map<String, PlanFile.TaskSpec> specs, Duration timeout) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, workers));
        Set<String> dispatched = ConcurrentHashMap.newKeySet();
        Instant deadline = Instant.now().plus(timeout);
        try {
            while (!manager.allSettled()) {
                if (Instant.now().isAfter(deadline)) {
                    return false;
                }
                for (Task task : manager.state().taskList()) {
                    String key = task.id() + "#" + task.retryCount();
                    PlanFile.TaskSpec spec = specs.get(task.id());
                    if (spec != null && task.status() == TaskStatus.ASSIGNED && dispatched.add(key)) {
                        String agentId = task.assignedAgentId();
                        executor.execute(() -> runTask(spec, agentId, key, dispatched));
                    }
                }
                Thread.sleep(POLL_MILLIS);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runTask(PlanFile.TaskSpec spec, String agentId, String key, Set<String> dispatched) {
        try {
            manager.execute(spec.id(), agentId, spec.endpoint(), spec.payload());
        } catch (IllegalStateException e) {
            // Moved to another agent or cancelled before it started; the next poll picks it up again
            dispatched.remove(key);
            log.debug("Task {} not started on {}: {}", spec.id(), agentId, e.getMessage());
        } catch (RuntimeException e) {
            dispatched.remove(key);
            log.warn("Task {} could not be executed on {}", spec.id(), agentId, e);
        }
    }
}
