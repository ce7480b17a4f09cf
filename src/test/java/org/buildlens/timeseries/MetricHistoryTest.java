package org.buildlens.timeseries;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.SnapshotMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricHistoryTest {
    private static final Instant NOW = Instant.parse("2026-03-10T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void computesStatisticsOverWholeHistory() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, CLOCK);
        double[] values = {10, 20, 30, 40, 50};
        for (int i = 0; i < values.length; i++) {
            history.append(snapshot(NOW.minus(Duration.ofDays(values.length - i)), values[i]));
        }

        MetricStatistics statistics = history.statistics(Metric.BUILD_TIME, null);

        assertEquals(10.0, statistics.min());
        assertEquals(50.0, statistics.max());
        assertEquals(30.0, statistics.average());
        assertEquals(30.0, statistics.median());
        assertEquals(14.142, statistics.standardDeviation(), 0.001);
        assertEquals(5, statistics.dataPoints());
    }

    @Test
    void statisticsWindowOnlyCoversRecentDays() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, CLOCK);
        history.append(snapshot(NOW.minus(Duration.ofDays(10)), 100));
        history.append(snapshot(NOW.minus(Duration.ofDays(2)), 20));
        history.append(snapshot(NOW.minus(Duration.ofDays(1)), 40));

        MetricStatistics statistics = history.statistics(Metric.BUILD_TIME, 3);

        assertEquals(2, statistics.dataPoints());
        assertEquals(30.0, statistics.average());
        assertEquals(30.0, statistics.median());
    }

    @Test
    void emptyHistoryYieldsEmptyResults() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 10, CLOCK);

        assertEquals(0, history.size());
        assertTrue(history.query(null, null).isEmpty());
        assertTrue(history.latest().isEmpty());
        assertEquals(MetricStatistics.empty(), history.statistics(Metric.BUNDLE_SIZE, 7));

        String csv = history.exportCsv();
        assertFalse(csv.contains("\n"));
        assertTrue(csv.startsWith("timestamp,buildTime,bundleSize,"));
        assertTrue(csv.endsWith(",gitCommit,branch,version,environment,triggeredBy"));
    }

    @Test
    void evictsOldestSnapshotsBeyondCapacity() {
        InMemorySnapshotStorage storage = new InMemorySnapshotStorage();
        MetricHistory history = new MetricHistory(storage, 3, CLOCK);
        for (int i = 1; i <= 5; i++) {
            history.append(snapshot(NOW.minus(Duration.ofHours(10 - i)), i));
        }

        assertEquals(3, history.size());
        assertEquals(3.0, history.snapshots().get(0).value(Metric.BUILD_TIME));
        assertEquals(5.0, history.latest().orElseThrow().value(Metric.BUILD_TIME));
        assertEquals(3, storage.load().size());
    }

    @Test
    void rejectsSnapshotOlderThanLatest() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 10, CLOCK);
        history.append(snapshot(NOW, 10));

        assertThrows(IllegalArgumentException.class, () -> history.append(snapshot(NOW.minusSeconds(1), 12)));
        history.append(snapshot(NOW, 11));
        assertEquals(2, history.size());
    }

    @Test
    void queryBoundsAreInclusive() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 10, CLOCK);
        Instant first = NOW.minus(Duration.ofDays(3));
        Instant second = NOW.minus(Duration.ofDays(2));
        Instant third = NOW.minus(Duration.ofDays(1));
        history.append(snapshot(first, 1));
        history.append(snapshot(second, 2));
        history.append(snapshot(third, 3));

        List<MetricSnapshot> matched = history.query(first, second);

        assertEquals(2, matched.size());
        assertEquals(first, matched.get(0).timestamp());
        assertEquals(second, matched.get(1).timestamp());
        assertEquals(1, history.query(third, null).size());
        assertEquals(3, history.query(null, third).size());
    }

    @Test
    void clearRemovesEverySnapshot() {
        InMemorySnapshotStorage storage = new InMemorySnapshotStorage();
        MetricHistory history = new MetricHistory(storage, 10, CLOCK);
        history.append(snapshot(NOW, 1));

        history.clear();

        assertEquals(0, history.size());
        assertTrue(storage.load().isEmpty());
        assertTrue(history.query(null, null).isEmpty());
    }

    @Test
    void exportsQuotedCsvRows() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 10, CLOCK);
        history.append(MetricSnapshot.builder(NOW)
                .value(Metric.BUILD_TIME, 42)
                .value(Metric.TEST_COVERAGE, 81.5)
                .metadata(new SnapshotMetadata("abc123", "feat,\"x\"", null, "ci", null))
                .build());

        String[] lines = history.exportCsv().split("\n");

        assertEquals(2, lines.length);
        assertTrue(lines[1].startsWith("\"2026-03-10T00:00:00Z\",\"42\",\"0\",\"81.5\","));
        assertTrue(lines[1].endsWith(",\"abc123\",\"feat,\"\"x\"\"\",\"\",\"ci\",\"\""));
    }

    @Test
    void persistsSnapshotsAsNdjson() throws Exception {
        Path file = tempDir.resolve("history").resolve("snapshots.ndjson");
        MetricHistory history = new MetricHistory(new NdjsonSnapshotStorage(file), 10, CLOCK);
        history.append(MetricSnapshot.builder(NOW.minusSeconds(60))
                .value(Metric.BUILD_TIME, 55.5)
                .metadata(new SnapshotMetadata("c1", "main", "1.0.0", "ci", "push"))
                .build());
        history.append(snapshot(NOW, 50));

        assertEquals(2, Files.readAllLines(file).size());

        MetricHistory reloaded = new MetricHistory(new NdjsonSnapshotStorage(file), 10, CLOCK);
        assertEquals(history.snapshots(), reloaded.snapshots());
        assertEquals("main", reloaded.snapshots().get(0).metadata().branch());
    }

    @Test
    void truncatesOversizedFileOnLoad() {
        Path file = tempDir.resolve("snapshots.ndjson");
        MetricHistory history = new MetricHistory(new NdjsonSnapshotStorage(file), 10, CLOCK);
        for (int i = 0; i < 4; i++) {
            history.append(snapshot(NOW.plusSeconds(i), i));
        }

        MetricHistory smaller = new MetricHistory(new NdjsonSnapshotStorage(file), 2, CLOCK);

        assertEquals(2, smaller.size());
        assertEquals(2.0, smaller.snapshots().get(0).value(Metric.BUILD_TIME));
        assertEquals(2, new NdjsonSnapshotStorage(file).load().size());
    }

    @Test
    void corruptLineFailsWithStorageException() throws Exception {
        Path file = tempDir.resolve("corrupt.ndjson");
        Files.writeString(file, "{\"timestamp\": 1773100800, \"values\": {\"buildTime\": 30}}\n");

        StorageException error = assertThrows(StorageException.class, () -> new NdjsonSnapshotStorage(file).load());

        assertTrue(error.getMessage().endsWith("corrupt.ndjson:1"));
        assertTrue(error.getCause() instanceof ClassCastException);
    }

    @Test
    void rejectsStoredSnapshotsOutOfOrder() {
        InMemorySnapshotStorage storage = new InMemorySnapshotStorage();
        storage.replaceAll(List.of(snapshot(NOW, 20), snapshot(NOW.minusSeconds(60), 30)));

        StorageException error = assertThrows(StorageException.class, () -> new MetricHistory(storage, 10, CLOCK));

        assertEquals(
                "stored snapshot 2 at 2026-03-09T23:59:00Z is older than its predecessor at 2026-03-10T00:00:00Z",
                error.getMessage());
    }

    @Test
    void acceptsStoredSnapshotsWithEqualTimestamps() {
        InMemorySnapshotStorage storage = new InMemorySnapshotStorage();
        storage.replaceAll(List.of(snapshot(NOW, 20), snapshot(NOW, 21)));

        assertEquals(2, new MetricHistory(storage, 10, CLOCK).size());
    }

    @Test
    void exportsCsvToFile() throws Exception {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 10, CLOCK);
        history.append(snapshot(NOW, 10));

        Path written = history.exportCsv(tempDir.resolve("out").resolve("history.csv"));

        assertEquals(history.exportCsv(), Files.readString(written));
    }

    private static MetricSnapshot snapshot(Instant timestamp, double buildTime) {
        return MetricSnapshot.builder(timestamp).value(Metric.BUILD_TIME, buildTime).build();
    }
}
