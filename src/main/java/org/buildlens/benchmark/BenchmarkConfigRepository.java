package org.buildlens.benchmark;

import java.util.List;
import java.util.Optional;

public interface BenchmarkConfigRepository {
    /**
     * Stores a config, replacing any config with the same name.
     */
    void save(BenchmarkConfig config);

    Optional<BenchmarkConfig> find(String name);

    /**
     * Names of all stored configs, sorted.
     */
    List<String> names();
}
