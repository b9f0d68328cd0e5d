package com.swarmcore.dispatch.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.AgentStatus;
import com.swarmcore.core.model.ResourceRequirements;
import com.swarmcore.core.model.Task;
import com.swarmcore.core.resources.ResourceDefinition;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON plan consumed by {@code swarmcore run}: resources, agents and the tasks to run on them.
 */
public record PlanFile(List<ResourceSpec> resources, List<AgentSpec> agents, List<TaskSpec> tasks) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public PlanFile {
        resources = resources == null ? List.of() : List.copyOf(resources);
        agents = agents == null ? List.of() : List.copyOf(agents);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static PlanFile read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), PlanFile.class);
    }

    public record ResourceSpec(String name, int capacity, boolean exclusive) {

        public ResourceDefinition toDefinition() {
            return exclusive ? ResourceDefinition.exclusive(name) : ResourceDefinition.shared(name, capacity);
        }
    }

    public record AgentSpec(String id, Set<String> capabilities, int maxConcurrentTasks) {

        public Agent toAgent() {
            return new Agent(id, capabilities, maxConcurrentTasks, AgentStatus.IDLE, 0, 0, 0, 0, null);
        }
    }

    /**
     * @param timeoutSeconds run deadline, 0 or absent for the coordinator default
     * @param maxRetries     retry budget, null for the configured default
     * @param endpoint       backend endpoint the task payload is sent to
     */
    public record TaskSpec(
        String id,
        List<String> dependsOn,
        int priority,
        Set<String> requires,
        Set<String> tags,
        Map<String, Integer> resources,
        Integer maxRetries,
        long timeoutSeconds,
        String endpoint,
        String payload
    ) {

        public TaskSpec {
            dependsOn = dependsOn == null ? List.of() : dependsOn;
            requires = requires == null ? Set.of() : requires;
            tags = tags == null ? Set.of() : tags;
            resources = resources == null ? Map.of() : resources;
            endpoint = endpoint == null ? "default" : endpoint;
        }

        public Task toTask(int defaultMaxRetries) {
            var builder = Task.builder(id)
                    .dependsOn(dependsOn)
                    .priority(priority)
                    .requires(requires)
                    .tags(tags.toArray(String[]::new))
                    .resources(new ResourceRequirements(resources))
                    .maxRetries(maxRetries == null ? defaultMaxRetries : maxRetries);
            if (timeoutSeconds > 0) {
                builder.timeout(Duration.ofSeconds(timeoutSeconds));
            }
            return builder.build();
        }
    }
}
