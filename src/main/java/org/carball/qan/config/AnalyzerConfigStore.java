package org.carball.qan.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps the configuration of each monitored instance in {@code qan-<uuid>.json} under a base
 * directory, so analyzers can be restarted with the same settings.
 */
@Slf4j
public class AnalyzerConfigStore {

    private static final String PREFIX = "qan-";
    private static final String SUFFIX = ".json";

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    public AnalyzerConfigStore(Path baseDir) {
        this.baseDir = baseDir;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path save(AnalyzerConfig config) throws IOException {
        if (config.getUuid() == null || config.getUuid().isBlank()) {
            throw new IllegalArgumentException("Cannot store a configuration without uuid");
        }
        Files.createDirectories(baseDir);
        Path file = fileFor(config.getUuid());
        objectMapper.writeValue(file.toFile(), config);
        log.info("Saved configuration for instance {} to {}", config.getUuid(), file);
        return file;
    }

    public Optional<AnalyzerConfig> load(String uuid) throws IOException {
        Path file = fileFor(uuid);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), AnalyzerConfig.class));
    }

    public boolean remove(String uuid) throws IOException {
        boolean removed = Files.deleteIfExists(fileFor(uuid));
        if (removed) {
            log.info("Removed configuration for instance {}", uuid);
        }
        return removed;
    }

    /**
     * Instance ids with a stored configuration, sorted.
     */
    public List<String> list() throws IOException {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(baseDir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.startsWith(PREFIX) && name.endsWith(SUFFIX))
                    .map(name -> name.substring(PREFIX.length(), name.length() - SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Path fileFor(String uuid) {
        return baseDir.resolve(PREFIX + uuid + SUFFIX);
    }
}
