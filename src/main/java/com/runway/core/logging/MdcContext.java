package com.runway.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Runway-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setInteraction(String sessionId, String interactionId, String executor) {
        MDC.put("sessionId", sessionId);
        MDC.put("interactionId", interactionId);
        if (executor != null) {
            MDC.put("executor", executor);
        }
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("interactionId");
        MDC.remove("executor");
    }
}
