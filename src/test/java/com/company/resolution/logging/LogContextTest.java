package com.company.resolution.logging;

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
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1", "cluster")) {
            assertEquals("run-1", MDC.get(LogContext.RUN_ID));
            assertEquals("cluster", MDC.get(LogContext.OPERATION));
        }
    }

    @Test
    @DisplayName("forBatch should set runId, batchId and the enrich operation")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("run-1", "batch_001")) {
            assertEquals("run-1", MDC.get(LogContext.RUN_ID));
            assertEquals("batch_001", MDC.get(LogContext.BATCH_ID));
            assertEquals("enrich", MDC.get(LogContext.OPERATION));
        }
    }

    @Test
    @DisplayName("Nested cluster context should leave the batch context in place on close")
    void nestedClusterContext() {
        try (LogContext batch = LogContext.forBatch("run-1", "batch_001")) {
            try (LogContext cluster = LogContext.forCluster("c-42").with("attempt", "2")) {
                assertEquals("c-42", MDC.get(LogContext.CLUSTER_ID));
                assertEquals("2", MDC.get("attempt"));
            }
            assertNull(MDC.get(LogContext.CLUSTER_ID));
            assertNull(MDC.get("attempt"));
            assertEquals("batch_001", MDC.get(LogContext.BATCH_ID));
        }
        assertNull(MDC.get(LogContext.BATCH_ID));
    }

    @Test
    @DisplayName("MDC should be cleared on close and a second close is harmless")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forRun("run-1", "enrich");
        assertNotNull(MDC.get(LogContext.RUN_ID));

        ctx.close();
        assertNull(MDC.get(LogContext.RUN_ID));
        assertNull(MDC.get(LogContext.OPERATION));
        assertDoesNotThrow(ctx::close);
    }

    @Test
    @DisplayName("generateRunId should produce unique ids")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
