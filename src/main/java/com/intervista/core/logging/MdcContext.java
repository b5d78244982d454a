package com.intervista.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Intervista-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String sessionId, String taskId, String taskType) {
        MDC.put("sessionId", sessionId);
        MDC.put("taskId", taskId);
        MDC.put("taskType", taskType);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("taskType");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskId");
        MDC.remove("taskType");
    }
}
