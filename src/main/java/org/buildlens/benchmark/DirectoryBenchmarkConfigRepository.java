package org.buildlens.benchmark;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.buildlens.config.StructuredDocumentLoader;
import org.buildlens.obs.JsonEncoder;

/**
 * Config repository over a directory of {@code .json}, {@code .yaml} or {@code .yml} files.
 *
 * <p>Every file is loaded on construction; saved configs are written as {@code <name>.json}.
 */
public final class DirectoryBenchmarkConfigRepository implements BenchmarkConfigRepository {
    private final Path directory;
    private final Map<String, BenchmarkConfig> configs = new ConcurrentHashMap<>();

    public DirectoryBenchmarkConfigRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        loadAll();
    }

    public Path directory() {
        return directory;
    }

    @Override
    public synchronized void save(BenchmarkConfig config) {
        Objects.requireNonNull(config, "config");
        Path target = directory.resolve(config.name() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(target, JsonEncoder.encode(BenchmarkConfigs.toMap(config)) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write benchmark config: " + target, e);
        }
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

    private void loadAll() {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(Files::isRegularFile).filter(StructuredDocumentLoader::isSupported).sorted().toList()) {
                try {
                    BenchmarkConfig config = BenchmarkConfigs.fromMap(StructuredDocumentLoader.load(file));
                    configs.put(config.name(), config);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("invalid benchmark config " + file + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to list benchmark configs: " + directory, e);
        }
    }
}
