package com.swarmcore.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.swarmcore.core.conflict.Versioned;
import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes task and agent snapshots to a {@link MemoryStore} as JSON and reads them back
 * after a restart.
 * <p>
 * Checkpointing is best-effort: store and serialization failures are logged and never
 * propagate, and a missing checkpoint is not an error.
 */
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    static final String TASK_INDEX = "index:tasks";
    static final String AGENT_INDEX = "index:agents";

    private final MemoryStore store;
    private final ObjectMapper objectMapper;

    public CheckpointService(MemoryStore store) {
        this.store = store;
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void saveTask(Versioned<Task> task) {
        write("task:" + task.id(), task, TASK_INDEX);
    }

    public void saveAgent(Versioned<Agent> agent) {
        write("agent:" + agent.id(), agent, AGENT_INDEX);
    }

    public void deleteAgent(String agentId) {
        try {
            store.delete("agent:" + agentId);
            updateIndex(AGENT_INDEX, agentId, false);
        } catch (RuntimeException e) {
            log.warn("Failed to delete checkpoint for agent {}: {}", agentId, e.getMessage());
        }
    }

    public Optional<Versioned<Task>> loadTask(String taskId) {
        return read("task:" + taskId, new TypeReference<Versioned<Task>>() {});
    }

    public Optional<Versioned<Agent>> loadAgent(String agentId) {
        return read("agent:" + agentId, new TypeReference<Versioned<Agent>>() {});
    }

    /**
     * Every checkpointed task, skipping entries that cannot be read.
     */
    public List<Versioned<Task>> loadTasks() {
        var result = new ArrayList<Versioned<Task>>();
        for (String id : index(TASK_INDEX)) {
            loadTask(id).ifPresent(result::add);
        }
        return result;
    }

    public List<Versioned<Agent>> loadAgents() {
        var result = new ArrayList<Versioned<Agent>>();
        for (String id : index(AGENT_INDEX)) {
            loadAgent(id).ifPresent(result::add);
        }
        return result;
    }

    private void write(String key, Object snapshot, String indexKey) {
        try {
            store.put(key, objectMapper.writeValueAsString(snapshot));
            updateIndex(indexKey, key.substring(key.indexOf(':') + 1), true);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to checkpoint {}: {}", key, e.getMessage());
        }
    }

    private <T> Optional<T> read(String key, TypeReference<T> type) {
        try {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private synchronized void updateIndex(String indexKey, String id, boolean add) {
        Set<String> ids = index(indexKey);
        boolean changed = add ? ids.add(id) : ids.remove(id);
        if (!changed) {
            return;
        }
        try {
            store.put(indexKey, objectMapper.writeValueAsString(ids));
        } catch (JsonProcessingException e) {
            log.warn("Failed to update checkpoint index {}: {}", indexKey, e.getMessage());
        }
    }

    private Set<String> index(String indexKey) {
        return read(indexKey, new TypeReference<LinkedHashSet<String>>() {})
                .map(ids -> (Set<String>) ids)
                .orElseGet(LinkedHashSet::new);
    }
}
