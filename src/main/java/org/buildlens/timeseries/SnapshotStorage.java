package org.buildlens.timeseries;

import java.util.List;
import org.buildlens.model.MetricSnapshot;

/**
 * Persistence backend of {@link MetricHistory}; implementations throw {@link StorageException} on failure.
 */
public interface SnapshotStorage {
    /**
     * Loads all stored snapshots in insertion order.
     */
    List<MetricSnapshot> load();

    void append(MetricSnapshot snapshot);

    /**
     * Replaces the stored contents, used after eviction and on clear.
     */
    void replaceAll(List<MetricSnapshot> snapshots);
}
