package org.buildlens.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class StructuredJsonLinesLoggerSmokeTest {
    @Test
    void emitsCorrelationAndCustomFieldsAsJsonLines() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Clock fixedClock = Clock.fixed(Instant.parse("2026-03-10T10:00:00Z"), ZoneOffset.UTC);
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(
                new OutputStreamWriter(output, StandardCharsets.UTF_8), fixedClock, true);

        CorrelationContext context = CorrelationContext.of("run-1", "validate")
                .forComponent("performance", "build-metrics");
        logger.warn("component failed", context, Map.of("error", "timeout", "runId", "ignored"));

        CorrelationContext runContext = CorrelationContext.of("run-2", "pipeline");
        logger.info("snapshot recorded", runContext);
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);

        Document first = Document.parse(lines[0]);
        assertEquals("2026-03-10T10:00:00Z", first.getString("timestamp"));
        assertEquals("WARN", first.getString("level"));
        assertEquals("component failed", first.getString("message"));
        assertEquals("run-1", first.getString("runId"));
        assertEquals("validate", first.getString("operation"));
        assertEquals("performance", first.getString("phase"));
        assertEquals("build-metrics", first.getString("component"));
        assertEquals("timeout", first.getString("error"));

        Document second = Document.parse(lines[1]);
        assertEquals("INFO", second.getString("level"));
        assertEquals("run-2", second.getString("runId"));
        assertNull(second.get("phase"));
        assertFalse(second.containsKey("component"));
    }

    @Test
    void rejectsBlankCorrelationIds() {
        assertThrows(IllegalArgumentException.class, () -> CorrelationContext.of("  ", "validate"));
    }

    @Test
    void encodesNestedValuesInInsertionOrder() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", 1.0);
        value.put("a", List.of("x", "y\"z"));
        value.put("nan", Double.NaN);
        value.put("at", Instant.parse("2026-03-10T00:00:00Z"));

        assertEquals(
                "{\"b\":1.0,\"a\":[\"x\",\"y\\\"z\"],\"nan\":null,\"at\":\"2026-03-10T00:00:00Z\"}",
                JsonEncoder.encode(value));
    }
}
