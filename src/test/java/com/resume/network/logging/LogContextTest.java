package com.resume.network.logging;

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
    @DisplayName("forSearch should set correlationId and operation in MDC")
    void forSearchSetsMDC() {
        try (LogContext ctx = LogContext.forSearch("corr-123", "similar")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("similar", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forIngestion should set batchId and operation in MDC")
    void forIngestionSetsMDC() {
        try (LogContext ctx = LogContext.forIngestion("batch-456")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("ingest", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forTranslation should set correlationId, oracle, and operation in MDC")
    void forTranslationSetsMDC() {
        try (LogContext ctx = LogContext.forTranslation("corr-789", "Ollama/llama3.2")) {
            assertEquals("corr-789", MDC.get("correlationId"));
            assertEquals("Ollama/llama3.2", MDC.get("oracle"));
            assertEquals("translate", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including added keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forSearch("corr-123", "path").with("snapshotVersion", "4");
        assertEquals("4", MDC.get("snapshotVersion"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("snapshotVersion"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique values")
    void generateCorrelationIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
