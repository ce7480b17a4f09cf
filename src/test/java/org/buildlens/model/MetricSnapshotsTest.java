package org.buildlens.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MetricSnapshotsTest {
    @Test
    void convertsSectionsToDisplayUnits() {
        PerformanceAnalysis performance = ValidationFixtures.healthyPerformance()
                .withMemoryProfile(new PerformanceAnalysis.MemoryProfile(
                        PerformanceAnalysis.MemoryStats.empty(),
                        new PerformanceAnalysis.MemoryStats(384 * ValidationFixtures.MEGABYTE, 0, 0, 0),
                        PerformanceAnalysis.MemoryStats.empty(),
                        List.of(),
                        List.of()))
                .withDevExperience(new PerformanceAnalysis.DevExperienceMetrics(7_500, 180, 0, 0, 0, 0, 0));
        ValidationResult result = ValidationFixtures.result(
                ValidationFixtures.healthySystem(), performance, ArchitectureValidation.empty(), Set.of());
        SnapshotMetadata metadata = new SnapshotMetadata("abc123", "main", null, "ci", null);

        MetricSnapshot snapshot = MetricSnapshots.fromResult(result, metadata);

        assertEquals(ValidationFixtures.NOW, snapshot.timestamp());
        assertEquals(20.0, snapshot.value(Metric.BUILD_TIME));
        assertEquals(4.0, snapshot.value(Metric.BUNDLE_SIZE));
        assertEquals(85.0, snapshot.value(Metric.TEST_COVERAGE));
        assertEquals(384.0, snapshot.value(Metric.MEMORY_USAGE));
        assertEquals(90.0, snapshot.value(Metric.CACHE_HIT_RATE));
        assertEquals(80.0, snapshot.value(Metric.PARALLEL_EFFICIENCY));
        assertEquals(100.0, snapshot.value(Metric.ARCHITECTURE_HEALTH_SCORE));
        assertEquals(7.5, snapshot.value(Metric.TYPESCRIPT_COMPILATION_TIME));
        assertEquals(180.0, snapshot.value(Metric.AUTOCOMPLETE_SPEED));
        assertEquals(Metric.values().length, snapshot.values().size());
        assertEquals(metadata, snapshot.metadata());
    }

    @Test
    void negativeAndNonFiniteMeasurementsBecomeZero() {
        PerformanceAnalysis performance = PerformanceAnalysis.empty()
                .withBuildMetrics(new PerformanceAnalysis.BuildMetrics(
                        -5_000, Map.of(), Double.NaN, Double.POSITIVE_INFINITY, 0, List.of()));
        ValidationResult result = ValidationFixtures.result(
                SystemValidation.empty(), performance, ArchitectureValidation.empty(), Set.of());

        MetricSnapshot snapshot = MetricSnapshots.fromResult(result, null);

        assertEquals(0.0, snapshot.value(Metric.BUILD_TIME));
        assertEquals(0.0, snapshot.value(Metric.PARALLEL_EFFICIENCY));
        assertEquals(0.0, snapshot.value(Metric.CACHE_HIT_RATE));
        assertEquals(SnapshotMetadata.empty(), snapshot.metadata());
    }
}
