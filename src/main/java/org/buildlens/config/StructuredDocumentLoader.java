package org.buildlens.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads configuration documents from JSON or YAML files into plain maps.
 */
public final class StructuredDocumentLoader {
    private StructuredDocumentLoader() {
    }

    public static Map<String, Object> load(Path path) {
        Objects.requireNonNull(path, "path");
        Path normalized = path.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new IllegalArgumentException("config path does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("config path must be a file: " + normalized);
        }
        try {
            String content = Files.readString(normalized, StandardCharsets.UTF_8);
            return parse(content, normalized.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read config file: " + normalized, e);
        }
    }

    /**
     * Loads a YAML document bundled on the classpath.
     */
    public static Map<String, Object> loadResource(Class<?> anchor, String resourceName) {
        try (InputStream stream = anchor.getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new IllegalStateException("missing classpath resource: " + resourceName);
            }
            return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8), resourceName);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read classpath resource: " + resourceName, e);
        }
    }

    public static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }

    static Map<String, Object> parse(String content, String sourceName) {
        Objects.requireNonNull(content, "content");
        String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return parseYaml(content);
        }
        try {
            return Document.parse(content);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid JSON in " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> parseYaml(String content) {
        Object root = new Yaml().load(content);
        if (root == null) {
            throw new IllegalArgumentException("config document is empty");
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("config root must be an object");
        }
        return ConfigValues.normalizeKeys(rawMap);
    }
}
