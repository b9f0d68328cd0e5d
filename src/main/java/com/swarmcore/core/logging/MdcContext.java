package com.swarmcore.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing coordination MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String agentId) {
        MDC.put("taskId", taskId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        }
    }

    public static void setEndpoint(String endpoint) {
        MDC.put("endpoint", endpoint);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("endpoint");
    }
}
