package org.buildlens.benchmark;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.buildlens.model.Metric;

/**
 * Named scoring configuration: the metrics it covers, their targets and tier thresholds.
 */
public final class BenchmarkConfig {
    private final String name;
    private final String description;
    private final List<Metric> metrics;
    private final Map<Metric, Double> targets;
    private final Map<ThresholdTier, Map<Metric, Double>> thresholds;
    private final String environment;
    private final String version;

    private BenchmarkConfig(Builder builder) {
        this.name = requireText(builder.name, "name");
        this.description = builder.description == null ? "" : builder.description.trim();
        if (builder.metrics.isEmpty()) {
            throw new IllegalArgumentException("metrics must not be empty");
        }
        this.metrics = List.copyOf(builder.metrics);
        this.targets = copyRestricted(builder.targets, "targets");
        Map<ThresholdTier, Map<Metric, Double>> tiers = new EnumMap<>(ThresholdTier.class);
        for (ThresholdTier tier : ThresholdTier.values()) {
            tiers.put(tier, copyRestricted(builder.thresholds.get(tier), "thresholds." + tier.key()));
        }
        this.thresholds = Map.copyOf(tiers);
        this.environment = normalize(builder.environment);
        this.version = normalize(builder.version);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<Metric> metrics() {
        return metrics;
    }

    public Map<Metric, Double> targets() {
        return targets;
    }

    public Optional<Double> target(Metric metric) {
        return Optional.ofNullable(targets.get(metric));
    }

    public Map<Metric, Double> thresholds(ThresholdTier tier) {
        return thresholds.get(Objects.requireNonNull(tier, "tier"));
    }

    /**
     * Whether all three tiers define a threshold for the metric.
     */
    public boolean hasThresholds(Metric metric) {
        for (ThresholdTier tier : ThresholdTier.values()) {
            if (!thresholds.get(tier).containsKey(metric)) {
                return false;
            }
        }
        return true;
    }

    public Optional<String> environment() {
        return Optional.ofNullable(environment);
    }

    public Optional<String> version() {
        return Optional.ofNullable(version);
    }

    private Map<Metric, Double> copyRestricted(Map<Metric, Double> source, String fieldName) {
        Map<Metric, Double> copy = new EnumMap<>(Metric.class);
        for (Map.Entry<Metric, Double> entry : source.entrySet()) {
            Metric metric = entry.getKey();
            if (!metrics.contains(metric)) {
                throw new IllegalArgumentException(fieldName + " references unlisted metric " + metric.key());
            }
            double value = entry.getValue();
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException(fieldName + "." + metric.key() + " must be finite and >= 0");
            }
            copy.put(metric, value);
        }
        return Map.copyOf(copy);
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String name;
        private String description;
        private final LinkedHashSet<Metric> metrics = new LinkedHashSet<>();
        private final Map<Metric, Double> targets = new EnumMap<>(Metric.class);
        private final Map<ThresholdTier, Map<Metric, Double>> thresholds = new EnumMap<>(ThresholdTier.class);
        private String environment;
        private String version;

        private Builder(String name) {
            this.name = name;
            for (ThresholdTier tier : ThresholdTier.values()) {
                thresholds.put(tier, new EnumMap<>(Metric.class));
            }
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder metric(Metric metric) {
            metrics.add(Objects.requireNonNull(metric, "metric"));
            return this;
        }

        public Builder target(Metric metric, double value) {
            targets.put(Objects.requireNonNull(metric, "metric"), value);
            return this;
        }

        public Builder threshold(ThresholdTier tier, Metric metric, double value) {
            thresholds.get(Objects.requireNonNull(tier, "tier")).put(Objects.requireNonNull(metric, "metric"), value);
            return this;
        }

        /**
         * Adds a metric with its target and the three tier thresholds in one call.
         */
        public Builder metric(Metric metric, double target, double excellent, double good, double poor) {
            return metric(metric)
                    .target(metric, target)
                    .threshold(ThresholdTier.EXCELLENT, metric, excellent)
                    .threshold(ThresholdTier.GOOD, metric, good)
                    .threshold(ThresholdTier.POOR, metric, poor);
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public BenchmarkConfig build() {
            return new BenchmarkConfig(this);
        }
    }
}
