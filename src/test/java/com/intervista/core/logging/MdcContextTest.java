package com.intervista.core.logging;

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
    @DisplayName("setSession puts sessionId in MDC")
    void setSession() {
        MdcContext.setSession("IVST-2026-1a2b3c4d");
        assertEquals("IVST-2026-1a2b3c4d", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setTask puts sessionId, taskId, and taskType in MDC")
    void setTask() {
        MdcContext.setTask("IVST-2026-1a2b3c4d", "IVST-2026-1a2b3c4d-SPEECH_ANALYSIS", "SPEECH_ANALYSIS");
        assertEquals("IVST-2026-1a2b3c4d", MDC.get("sessionId"));
        assertEquals("IVST-2026-1a2b3c4d-SPEECH_ANALYSIS", MDC.get("taskId"));
        assertEquals("SPEECH_ANALYSIS", MDC.get("taskType"));
    }

    @Test
    @DisplayName("clearTask keeps the session")
    void clearTask() {
        MdcContext.setTask("IVST-1", "IVST-1-FEEDBACK", "FEEDBACK");
        MdcContext.clearTask();
        assertEquals("IVST-1", MDC.get("sessionId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("taskType"));
    }

    @Test
    @DisplayName("clear removes all intervista MDC keys")
    void clear() {
        MdcContext.setTask("IVST-1", "IVST-1-FEEDBACK", "FEEDBACK");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("taskType"));
    }
}
