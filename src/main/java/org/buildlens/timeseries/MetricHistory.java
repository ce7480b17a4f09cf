package org.buildlens.timeseries;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.SnapshotMetadata;

/**
 * Bounded, chronologically ordered history of metric snapshots.
 *
 * <p>Writers are serialized; readers always see a complete immutable list, either before or after
 * a concurrent write.
 */
public final class MetricHistory {
    public static final int DEFAULT_MAX_POINTS = 1000;

    private static final String CSV_HEADER = buildCsvHeader();

    private final SnapshotStorage storage;
    private final int maxPoints;
    private final Clock clock;
    private volatile List<MetricSnapshot> snapshots;

    public MetricHistory(SnapshotStorage storage, int maxPoints) {
        this(storage, maxPoints, Clock.systemUTC());
    }

    public MetricHistory(SnapshotStorage storage, int maxPoints, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be >= 1");
        }
        this.maxPoints = maxPoints;
        this.clock = Objects.requireNonNull(clock, "clock");
        List<MetricSnapshot> loaded = storage.load();
        requireChronological(loaded);
        if (loaded.size() > maxPoints) {
            loaded = List.copyOf(loaded.subList(loaded.size() - maxPoints, loaded.size()));
            storage.replaceAll(loaded);
        }
        this.snapshots = List.copyOf(loaded);
    }

    private static void requireChronological(List<MetricSnapshot> loaded) {
        for (int i = 1; i < loaded.size(); i++) {
            Instant previous = loaded.get(i - 1).timestamp();
            Instant current = loaded.get(i).timestamp();
            if (current.isBefore(previous)) {
                throw new StorageException(
                        "stored snapshot " + (i + 1) + " at " + current + " is older than its predecessor at " + previous);
            }
        }
    }

    public static MetricHistory inMemory() {
        return new MetricHistory(new InMemorySnapshotStorage(), DEFAULT_MAX_POINTS);
    }

    /**
     * Appends a snapshot, evicting the oldest entries beyond the configured capacity.
     *
     * @throws IllegalArgumentException if the snapshot is older than the latest stored one
     * @throws StorageException if the backend rejects the write; the history is left unchanged
     */
    public synchronized void append(MetricSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<MetricSnapshot> current = snapshots;
        if (!current.isEmpty()) {
            Instant latest = current.get(current.size() - 1).timestamp();
            if (snapshot.timestamp().isBefore(latest)) {
                throw new IllegalArgumentException(
                        "snapshot timestamp " + snapshot.timestamp() + " is older than latest " + latest);
            }
        }
        List<MetricSnapshot> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(snapshot);
        if (next.size() > maxPoints) {
            next = new ArrayList<>(next.subList(next.size() - maxPoints, next.size()));
            storage.replaceAll(next);
        } else {
            storage.append(snapshot);
        }
        snapshots = List.copyOf(next);
    }

    /**
     * Returns snapshots with {@code start <= timestamp <= end}; a null bound is unbounded.
     */
    public List<MetricSnapshot> query(Instant start, Instant end) {
        List<MetricSnapshot> current = snapshots;
        List<MetricSnapshot> matched = new ArrayList<>();
        for (MetricSnapshot snapshot : current) {
            Instant timestamp = snapshot.timestamp();
            if (start != null && timestamp.isBefore(start)) {
                continue;
            }
            if (end != null && timestamp.isAfter(end)) {
                continue;
            }
            matched.add(snapshot);
        }
        return List.copyOf(matched);
    }

    public List<MetricSnapshot> snapshots() {
        return snapshots;
    }

    /**
     * Snapshots taken within the last {@code days} days relative to the clock.
     */
    public List<MetricSnapshot> lastDays(int days) {
        return query(windowStart(days), null);
    }

    public Optional<MetricSnapshot> latest() {
        List<MetricSnapshot> current = snapshots;
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(current.size() - 1));
    }

    public int size() {
        return snapshots.size();
    }

    public int maxPoints() {
        return maxPoints;
    }

    public Instant now() {
        return Instant.now(clock);
    }

    /**
     * Statistics of one metric; a null window covers the whole history.
     */
    public MetricStatistics statistics(Metric metric, Integer windowDays) {
        Objects.requireNonNull(metric, "metric");
        List<MetricSnapshot> window = windowDays == null ? snapshots : lastDays(windowDays);
        double[] values = new double[window.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = window.get(i).value(metric);
        }
        return MetricStatistics.of(values);
    }

    public synchronized void clear() {
        storage.replaceAll(List.of());
        snapshots = List.of();
    }

    public String exportCsv() {
        StringBuilder csv = new StringBuilder(CSV_HEADER);
        for (MetricSnapshot snapshot : snapshots) {
            csv.append('\n');
            List<String> cells = new ArrayList<>();
            cells.add(snapshot.timestamp().toString());
            for (Metric metric : Metric.values()) {
                cells.add(formatNumber(snapshot.value(metric)));
            }
            SnapshotMetadata metadata = snapshot.metadata();
            cells.add(metadata.gitCommit());
            cells.add(metadata.branch());
            cells.add(metadata.version());
            cells.add(metadata.environment());
            cells.add(metadata.triggeredBy());
            for (int i = 0; i < cells.size(); i++) {
                if (i > 0) {
                    csv.append(',');
                }
                csv.append(quote(cells.get(i)));
            }
        }
        return csv.toString();
    }

    public Path exportCsv(Path target) {
        Objects.requireNonNull(target, "target");
        Path normalized = target.toAbsolutePath().normalize();
        try {
            Path parent = normalized.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(normalized, exportCsv(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("failed to export snapshot history: " + normalized, e);
        }
        return normalized;
    }

    private Instant windowStart(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0");
        }
        return Instant.now(clock).minus(Duration.ofDays(days));
    }

    private static String buildCsvHeader() {
        StringBuilder header = new StringBuilder("timestamp");
        for (Metric metric : Metric.values()) {
            header.append(',').append(metric.key());
        }
        header.append(",gitCommit,branch,version,environment,triggeredBy");
        return header.toString();
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String quote(String value) {
        String safe = value == null ? "" : value;
        return '"' + safe.replace("\"", "\"\"") + '"';
    }
}
