package org.buildlens.benchmark;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class InMemoryBenchmarkResultRepository implements BenchmarkResultRepository {
    private final Map<String, BenchmarkResult> results = new LinkedHashMap<>();

    @Override
    public synchronized void save(BenchmarkResult result) {
        Objects.requireNonNull(result, "result");
        results.put(result.id(), result);
    }

    @Override
    public synchronized Optional<BenchmarkResult> find(String id) {
        return Optional.ofNullable(results.get(id));
    }

    @Override
    public synchronized List<BenchmarkResult> history(String configName) {
        List<BenchmarkResult> matched = new ArrayList<>();
        for (BenchmarkResult result : results.values()) {
            if (result.configName().equals(configName)) {
                matched.add(result);
            }
        }
        return List.copyOf(matched);
    }
}
