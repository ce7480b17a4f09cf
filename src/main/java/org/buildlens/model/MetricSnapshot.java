package org.buildlens.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time measurement of every tracked metric.
 */
public final class MetricSnapshot {
    private final Instant timestamp;
    private final Map<Metric, Double> values;
    private final SnapshotMetadata metadata;

    private MetricSnapshot(Instant timestamp, Map<Metric, Double> values, SnapshotMetadata metadata) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.values = values;
        this.metadata = metadata == null ? SnapshotMetadata.empty() : metadata;
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    public Instant timestamp() {
        return timestamp;
    }

    public double value(Metric metric) {
        return values.get(Objects.requireNonNull(metric, "metric"));
    }

    public Map<Metric, Double> values() {
        return values;
    }

    public SnapshotMetadata metadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MetricSnapshot that)) {
            return false;
        }
        return timestamp.equals(that.timestamp) && values.equals(that.values) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, values, metadata);
    }

    @Override
    public String toString() {
        return "MetricSnapshot{" + "timestamp=" + timestamp + ", values=" + values + ", metadata=" + metadata + '}';
    }

    public static final class Builder {
        private final Instant timestamp;
        private final Map<Metric, Double> values = new EnumMap<>(Metric.class);
        private SnapshotMetadata metadata = SnapshotMetadata.empty();

        private Builder(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public Builder value(Metric metric, double value) {
            Objects.requireNonNull(metric, "metric");
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException(metric.key() + " must be a finite non-negative number");
            }
            values.put(metric, value);
            return this;
        }

        public Builder metadata(SnapshotMetadata metadata) {
            this.metadata = Objects.requireNonNull(metadata, "metadata");
            return this;
        }

        public MetricSnapshot build() {
            Map<Metric, Double> complete = new EnumMap<>(Metric.class);
            for (Metric metric : Metric.values()) {
                complete.put(metric, values.getOrDefault(metric, 0.0));
            }
            return new MetricSnapshot(timestamp, Collections.unmodifiableMap(complete), metadata);
        }
    }
}
