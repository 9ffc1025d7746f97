package com.cape.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setExecution puts traceId, capabilityId and sessionId in MDC")
    void setExecution() {
        MdcContext.setExecution("trace-1", "xlsx-report", "analysis");
        assertEquals("trace-1", MDC.get("traceId"));
        assertEquals("xlsx-report", MDC.get("capabilityId"));
        assertEquals("analysis", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setExecution without a session drops a stale sessionId")
    void setExecutionWithoutSession() {
        MdcContext.setExecution("trace-1", "xlsx-report", "analysis");
        MdcContext.setExecution("trace-2", "summarize", null);
        assertEquals("trace-2", MDC.get("traceId"));
        assertNull(MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setCapability replaces only the capability id")
    void setCapability() {
        MdcContext.setExecution("trace-1", "pipeline", null);
        MdcContext.setCapability("translate");
        assertEquals("translate", MdcContext.currentCapability());
        assertEquals("trace-1", MDC.get("traceId"));
    }

    @Test
    @DisplayName("clear removes all cape MDC keys")
    void clear() {
        MdcContext.setExecution("trace-1", "xlsx-report", "analysis");
        MDC.put("other", "kept");
        MdcContext.clear();
        assertNull(MDC.get("traceId"));
        assertNull(MDC.get("capabilityId"));
        assertNull(MDC.get("sessionId"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
