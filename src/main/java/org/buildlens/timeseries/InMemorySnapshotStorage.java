package org.buildlens.timeseries;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.buildlens.model.MetricSnapshot;

public final class InMemorySnapshotStorage implements SnapshotStorage {
    private final List<MetricSnapshot> snapshots = new ArrayList<>();

    @Override
    public synchronized List<MetricSnapshot> load() {
        return List.copyOf(snapshots);
    }

    @Override
    public synchronized void append(MetricSnapshot snapshot) {
        snapshots.add(Objects.requireNonNull(snapshot, "snapshot"));
    }

    @Override
    public synchronized void replaceAll(List<MetricSnapshot> replacement) {
        snapshots.clear();
        snapshots.addAll(replacement);
    }
}
