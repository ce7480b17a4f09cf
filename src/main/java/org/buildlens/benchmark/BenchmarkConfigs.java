package org.buildlens.benchmark;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.buildlens.config.ConfigValues;
import org.buildlens.config.StructuredDocumentLoader;
import org.buildlens.model.Metric;

/**
 * Converts benchmark configs to and from their document form and provides the bundled defaults.
 *
 * <p>Document shape: {@code name, description, metrics[], targets{}, thresholds{excellent{}, good{},
 * poor{}}, environment, version}, keyed by metric keys such as {@code buildTime}.
 */
public final class BenchmarkConfigs {
    static final String DEFAULTS_RESOURCE = "default-benchmarks.yaml";

    private BenchmarkConfigs() {
    }

    public static BenchmarkConfig fromMap(Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        BenchmarkConfig.Builder builder = BenchmarkConfig.builder(ConfigValues.requireString(document, "name"))
                .description(ConfigValues.readString(document, "description"))
                .environment(ConfigValues.readString(document, "environment"))
                .version(ConfigValues.readString(document, "version"));
        for (String key : ConfigValues.readStringList(document, "metrics")) {
            builder.metric(Metric.fromKey(key));
        }
        for (Map.Entry<String, Double> entry : ConfigValues.readNumberMap(document, "targets").entrySet()) {
            builder.target(Metric.fromKey(entry.getKey()), entry.getValue());
        }
        Map<String, Object> thresholds = ConfigValues.readMap(document, "thresholds");
        if (thresholds != null) {
            for (ThresholdTier tier : ThresholdTier.values()) {
                for (Map.Entry<String, Double> entry : ConfigValues.readNumberMap(thresholds, tier.key()).entrySet()) {
                    builder.threshold(tier, Metric.fromKey(entry.getKey()), entry.getValue());
                }
            }
        }
        return builder.build();
    }

    public static Map<String, Object> toMap(BenchmarkConfig config) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", config.name());
        document.put("description", config.description());
        document.put("metrics", config.metrics().stream().map(Metric::key).toList());
        document.put("targets", keyed(config.targets(), config));
        Map<String, Object> thresholds = new LinkedHashMap<>();
        for (ThresholdTier tier : ThresholdTier.values()) {
            thresholds.put(tier.key(), keyed(config.thresholds(tier), config));
        }
        document.put("thresholds", thresholds);
        config.environment().ifPresent(value -> document.put("environment", value));
        config.version().ifPresent(value -> document.put("version", value));
        return document;
    }

    /**
     * Configs bundled with the library: {@code phase-a-validation} and {@code developer-experience}.
     */
    public static List<BenchmarkConfig> defaults() {
        Map<String, Object> root = StructuredDocumentLoader.loadResource(BenchmarkConfigs.class, DEFAULTS_RESOURCE);
        return ConfigValues.readMapList(root, "benchmarks").stream()
                .map(BenchmarkConfigs::fromMap)
                .toList();
    }

    private static Map<String, Double> keyed(Map<Metric, Double> values, BenchmarkConfig config) {
        Map<String, Double> keyed = new LinkedHashMap<>();
        for (Metric metric : config.metrics()) {
            Double value = values.get(metric);
            if (value != null) {
                keyed.put(metric.key(), value);
            }
        }
        return keyed;
    }
}
