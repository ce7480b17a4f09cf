package org.buildlens.benchmark;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.buildlens.model.Metric;
import org.buildlens.timeseries.StorageException;

/**
 * Result repository storing each result as {@code <root>/<id>.json}, one directory per config.
 */
public final class DirectoryBenchmarkResultRepository implements BenchmarkResultRepository {
    private final Path root;

    public DirectoryBenchmarkResultRepository(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public synchronized void save(BenchmarkResult result) {
        Objects.requireNonNull(result, "result");
        Path target = pathOf(result.id());
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, toDocument(result).toJson() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("failed to write benchmark result: " + target, e);
        }
    }

    @Override
    public synchronized Optional<BenchmarkResult> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Path source = pathOf(id);
        if (!source.startsWith(root) || !Files.isRegularFile(source)) {
            return Optional.empty();
        }
        return Optional.of(read(source));
    }

    @Override
    public synchronized List<BenchmarkResult> history(String configName) {
        Path configDirectory = root.resolve(configName).normalize();
        if (!configDirectory.startsWith(root) || !Files.isDirectory(configDirectory)) {
            return List.of();
        }
        List<BenchmarkResult> results = new ArrayList<>();
        try (Stream<Path> files = Files.list(configDirectory)) {
            for (Path file : files.filter(path -> path.getFileName().toString().endsWith(".json")).sorted().toList()) {
                results.add(read(file));
            }
        } catch (IOException e) {
            throw new StorageException("failed to list benchmark results: " + configDirectory, e);
        }
        return List.copyOf(results);
    }

    private Path pathOf(String id) {
        return root.resolve(id + ".json").normalize();
    }

    private static BenchmarkResult read(Path file) {
        try {
            return fromDocument(Document.parse(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new StorageException("failed to read benchmark result: " + file, e);
        } catch (JsonParseException | IllegalArgumentException | ClassCastException | NullPointerException
                | DateTimeParseException e) {
            throw new StorageException("invalid benchmark result: " + file, e);
        }
    }

    static Document toDocument(BenchmarkResult result) {
        return new Document("id", result.id())
                .append("configName", result.configName())
                .append("timestamp", result.timestamp().toString())
                .append("results", metricDocument(result.results()))
                .append("scores", metricDocument(result.scores()))
                .append("overallScore", result.overallScore())
                .append("grade", result.grade().name())
                .append("passed", result.passed())
                .append("metadata", new Document(new LinkedHashMap<String, Object>(result.metadata())));
    }

    static BenchmarkResult fromDocument(Document document) {
        Map<String, String> metadata = new LinkedHashMap<>();
        Document rawMetadata = document.get("metadata", Document.class);
        if (rawMetadata != null) {
            for (Map.Entry<String, Object> entry : rawMetadata.entrySet()) {
                metadata.put(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
        return new BenchmarkResult(
                document.getString("id"),
                document.getString("configName"),
                Instant.parse(document.getString("timestamp")),
                metricValues(document.get("results", Document.class)),
                metricValues(document.get("scores", Document.class)),
                ((Number) document.get("overallScore")).doubleValue(),
                Grade.valueOf(document.getString("grade")),
                document.getBoolean("passed", false),
                metadata);
    }

    private static Document metricDocument(Map<Metric, Double> values) {
        Document document = new Document();
        for (Metric metric : Metric.values()) {
            Double value = values.get(metric);
            if (value != null) {
                document.append(metric.key(), value);
            }
        }
        return document;
    }

    private static Map<Metric, Double> metricValues(Document document) {
        Map<Metric, Double> values = new EnumMap<>(Metric.class);
        if (document == null) {
            return values;
        }
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            values.put(Metric.fromKey(entry.getKey()), ((Number) entry.getValue()).doubleValue());
        }
        return values;
    }
}
