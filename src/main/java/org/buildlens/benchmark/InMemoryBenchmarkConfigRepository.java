package org.buildlens.benchmark;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryBenchmarkConfigRepository implements BenchmarkConfigRepository {
    private final Map<String, BenchmarkConfig> configs = new ConcurrentHashMap<>();

    @Override
    public void save(BenchmarkConfig config) {
        Objects.requireNonNull(config, "config");
        configs.put(config.name(), config);
    }

    @Override
    public Optional<BenchmarkConfig> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(configs.get(name));
    }

    @Override
    public List<String> names() {
        return configs.keySet().stream().sorted().toList();
    }
}
