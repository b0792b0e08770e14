package com.world.registry.logging;

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
    @DisplayName("forResolution should set correlationId, identityKind, and operation in MDC")
    void forResolutionSetsMDC() {
        try (LogContext ctx = LogContext.forResolution("corr-123", "NPC")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("NPC", MDC.get("identityKind"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBuild and forSource should set their keys")
    void buildAndSourceSetMDC() {
        try (LogContext ctx = LogContext.forBuild("index")) {
            assertEquals("build", MDC.get("operation"));
            assertEquals("index", MDC.get("stage"));
        }
        try (LogContext ctx = LogContext.forSource("campaign")) {
            assertEquals("parse", MDC.get("operation"));
            assertEquals("campaign", MDC.get("sourceId"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forOverlay("batch-1").with("target", "Korm");
        assertEquals("batch-1", MDC.get("batchId"));
        assertEquals("Korm", MDC.get("target"));

        ctx.close();

        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("target"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Correlation IDs should be unique")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
