package com.profitrate.reconciliation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Run context sets and clears its keys")
    void runContext() {
        try (LogContext ignored = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("reconcile", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested contexts restore the outer value")
    void nestedRestore() {
        try (LogContext outer = LogContext.forVariable("K", "load")) {
            try (LogContext inner = LogContext.forVariable("K", "merge")) {
                assertEquals("merge", MDC.get("stage"));
            }
            assertEquals("load", MDC.get("stage"));
            assertEquals("K", MDC.get("variableId"));
        }
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("Additional keys are removed on close")
    void withKey() {
        try (LogContext ignored = LogContext.forIdentity("rate-of-profit").with("year", "1970")) {
            assertEquals("rate-of-profit", MDC.get("identity"));
            assertEquals("validate", MDC.get("stage"));
            assertEquals("1970", MDC.get("year"));
        }
        assertNull(MDC.get("year"));
        assertNull(MDC.get("identity"));
    }

    @Test
    @DisplayName("Run ids are unique")
    void uniqueRunIds() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
