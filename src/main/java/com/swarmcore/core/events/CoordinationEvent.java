package com.swarmcore.core.events;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Coordination event delivered through the {@link MessageRouter}.
 *
 * @param id        unique event id
 * @param type      what happened
 * @param taskId    subject task, null for agent events
 * @param agentId   agent involved, may be null
 * @param payload   event-specific details
 * @param timestamp emission time
 */
public record CoordinationEvent(
    String id,
    CoordinationEventType type,
    String taskId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public CoordinationEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static CoordinationEvent of(CoordinationEventType type, String taskId, String agentId,
                                       Map<String, Object> payload, Instant timestamp) {
        return new CoordinationEvent(UUID.randomUUID().toString(), type, taskId, agentId, payload, timestamp);
    }
}
