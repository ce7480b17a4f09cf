package org.buildlens.timeseries;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import org.bson.Document;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.SnapshotMetadata;

/**
 * Converts snapshots to and from BSON documents for line-oriented storage.
 */
final class SnapshotDocuments {
    private SnapshotDocuments() {
    }

    static Document toDocument(MetricSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Document values = new Document();
        for (Metric metric : Metric.values()) {
            values.append(metric.key(), snapshot.value(metric));
        }
        Document metadata = new Document();
        metadata.putAll(snapshot.metadata().asMap());
        return new Document("timestamp", snapshot.timestamp().toString())
                .append("values", values)
                .append("metadata", metadata);
    }

    static MetricSnapshot fromDocument(Document document) {
        Objects.requireNonNull(document, "document");
        String timestamp = document.getString("timestamp");
        if (timestamp == null) {
            throw new IllegalArgumentException("snapshot document is missing timestamp");
        }
        MetricSnapshot.Builder builder;
        try {
            builder = MetricSnapshot.builder(Instant.parse(timestamp));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid snapshot timestamp: " + timestamp, e);
        }
        Object rawValues = document.get("values");
        if (rawValues instanceof Document values) {
            for (Metric metric : Metric.values()) {
                Object value = values.get(metric.key());
                if (value instanceof Number number) {
                    builder.value(metric, number.doubleValue());
                }
            }
        }
        Object rawMetadata = document.get("metadata");
        if (rawMetadata instanceof Document metadata) {
            builder.metadata(new SnapshotMetadata(
                    metadata.getString("gitCommit"),
                    metadata.getString("branch"),
                    metadata.getString("version"),
                    metadata.getString("environment"),
                    metadata.getString("triggeredBy")));
        }
        return builder.build();
    }
}
