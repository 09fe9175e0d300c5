package com.umls.sync.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forSync should set runId, version and operation in MDC")
    void forSyncSetsMDC() {
        try (LogContext ctx = LogContext.forSync("run-123", "2025AA")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("2025AA", MDC.get("version"));
            assertEquals("sync", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Nested phase context should leave the run context in place")
    void nestedPhase() {
        try (LogContext run = LogContext.forSync("run-123", "2025AA")) {
            try (LogContext phase = LogContext.forPhase("LOADED")) {
                assertEquals("LOADED", MDC.get("phase"));
                assertEquals("run-123", MDC.get("runId"));
            }
            assertNull(MDC.get("phase"));
            assertEquals("run-123", MDC.get("runId"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forExtraction("MRCONSO.RRF").with("chunk", "3");
        assertEquals("MRCONSO.RRF", MDC.get("file"));
        assertEquals("3", MDC.get("chunk"));

        ctx.close();

        assertNull(MDC.get("file"));
        assertNull(MDC.get("chunk"));
    }

    @Test
    @DisplayName("generateRunId should return unique values")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
