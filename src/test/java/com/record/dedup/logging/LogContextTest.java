package com.record.dedup.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Deduplication context populates and clears MDC")
    void deduplicationContext() {
        try (LogContext ctx = LogContext.forDeduplication("run-1", 42)) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("42", MDC.get("recordCount"));
            assertEquals("deduplicate", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Extra keys are removed on close")
    void withExtraKey() {
        try (LogContext ctx = LogContext.forTransfer("import", "data.csv").with("format", "csv")) {
            assertEquals("import", MDC.get("operation"));
            assertEquals("data.csv", MDC.get("source"));
            assertEquals("csv", MDC.get("format"));
        }
        assertNull(MDC.get("format"));
        assertNull(MDC.get("source"));
    }

    @Test
    @DisplayName("Closing a nested context restores the outer values")
    void nestedContexts() {
        try (LogContext outer = LogContext.forTransfer("cli", "data.csv")) {
            try (LogContext inner = LogContext.forDeduplication("run-2", 3)) {
                assertEquals("deduplicate", MDC.get("operation"));
            }
            assertEquals("cli", MDC.get("operation"));
            assertEquals("data.csv", MDC.get("source"));
            assertNull(MDC.get("runId"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Overwriting a key within one context still clears it on close")
    void overwriteWithinContext() {
        try (LogContext ctx = LogContext.forTransfer("import", "a.csv").with("operation", "export")) {
            assertEquals("export", MDC.get("operation"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Run ids are unique")
    void runIds() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
