package org.buildlens.benchmark;

import java.util.List;
import java.util.Optional;

public interface BenchmarkResultRepository {
    void save(BenchmarkResult result);

    Optional<BenchmarkResult> find(String id);

    /**
     * All results of a config in the order they were saved.
     */
    List<BenchmarkResult> history(String configName);

    default boolean exists(String id) {
        return find(id).isPresent();
    }
}
