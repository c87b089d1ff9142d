package com.fleet.resolution.logging;

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
    @DisplayName("forResolution should set correlationId, operation and target in MDC")
    void forResolutionSetsMDC() {
        try (LogContext ctx = LogContext.forResolution("getNodeScaleSetId", "node-1")) {
            assertNotNull(MDC.get("correlationId"));
            assertEquals("getNodeScaleSetId", MDC.get("operation"));
            assertEquals("node-1", MDC.get("target"));
        }
    }

    @Test
    @DisplayName("forInvalidation should tag the node being invalidated")
    void forInvalidationSetsMDC() {
        try (LogContext ctx = LogContext.forInvalidation("node-2")) {
            assertEquals("invalidateNode", MDC.get("operation"));
            assertEquals("node-2", MDC.get("target"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC, including extra keys")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forResolution("getScaleSetById", "ss-a")
                .with("readType", "FORCE_REFRESH")) {
            assertEquals("FORCE_REFRESH", MDC.get("readType"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("target"));
        assertNull(MDC.get("readType"));
    }

    @Test
    @DisplayName("Correlation IDs should be unique")
    void correlationIdsUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
