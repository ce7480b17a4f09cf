package org.buildlens.timeseries;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.buildlens.model.MetricSnapshot;

/**
 * File-backed storage with one JSON snapshot document per line.
 *
 * <p>Rewrites go through a sibling temp file and an atomic move so a reader never sees a partial file.
 */
public final class NdjsonSnapshotStorage implements SnapshotStorage {
    private final Path file;

    public NdjsonSnapshotStorage(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized List<MetricSnapshot> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("failed to read snapshot history: " + file, e);
        }
        List<MetricSnapshot> snapshots = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                snapshots.add(SnapshotDocuments.fromDocument(Document.parse(line)));
            } catch (JsonParseException | IllegalArgumentException | ClassCastException e) {
                throw new StorageException("invalid snapshot at " + file + ":" + (i + 1), e);
            }
        }
        return List.copyOf(snapshots);
    }

    @Override
    public synchronized void append(MetricSnapshot snapshot) {
        String line = SnapshotDocuments.toDocument(snapshot).toJson() + "\n";
        try {
            createParent();
            Files.writeString(
                    file,
                    line,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("failed to append snapshot: " + file, e);
        }
    }

    @Override
    public synchronized void replaceAll(List<MetricSnapshot> snapshots) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            createParent();
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (MetricSnapshot snapshot : snapshots) {
                    writer.write(SnapshotDocuments.toDocument(snapshot).toJson());
                    writer.write('\n');
                }
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("failed to rewrite snapshot history: " + file, e);
        }
    }

    private void createParent() throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
