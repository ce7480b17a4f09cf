package org.buildlens.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * JSON-lines logger for pipeline diagnostics; one event per line, extra fields in key order.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final boolean closeUnderlying;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, true);
    }

    /**
     * Logger over stderr that leaves the stream open on close.
     */
    public static StructuredJsonLinesLogger stderr() {
        return new StructuredJsonLinesLogger(
                new OutputStreamWriter(System.err, StandardCharsets.UTF_8), Clock.systemUTC(), true, false);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this(writer, clock, autoFlush, true);
    }

    private StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush, boolean closeUnderlying) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closeUnderlying = closeUnderlying;
        this.closed = false;
    }

    @Override
    public synchronized void log(
            String level,
            String message,
            CorrelationContext correlationContext,
            Map<String, ?> fields) {
        ensureOpen();
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", normalizeLevel(level));
        event.put("message", message == null ? "" : message);
        event.putAll(safeCorrelation.asFields());
        Map<String, Object> extra = new TreeMap<>();
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                String key = entry.getKey();
                if (key == null || key.isBlank() || event.containsKey(key)) {
                    continue;
                }
                extra.put(key, entry.getValue());
            }
        }
        event.putAll(extra);

        writeLine(JsonEncoder.encode(event));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            if (closeUnderlying) {
                writer.close();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase();
    }
}
