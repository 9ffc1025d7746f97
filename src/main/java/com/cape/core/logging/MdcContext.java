package com.cape.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing the engine's MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TRACE_ID = "traceId";
    public static final String CAPABILITY_ID = "capabilityId";
    public static final String SESSION_ID = "sessionId";

    private MdcContext() {}

    public static void setExecution(String traceId, String capabilityId, String sessionId) {
        MDC.put(TRACE_ID, traceId);
        MDC.put(CAPABILITY_ID, capabilityId);
        if (sessionId != null) {
            MDC.put(SESSION_ID, sessionId);
        } else {
            MDC.remove(SESSION_ID);
        }
    }

    public static void setCapability(String capabilityId) {
        MDC.put(CAPABILITY_ID, capabilityId);
    }

    public static String currentCapability() {
        return MDC.get(CAPABILITY_ID);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(CAPABILITY_ID);
        MDC.remove(SESSION_ID);
    }
}
