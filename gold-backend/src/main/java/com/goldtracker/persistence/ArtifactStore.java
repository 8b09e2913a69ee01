package com.goldtracker.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldtracker.api.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Flat-file artifacts under the data directory. Every write goes to a temp file that is
 * then moved over the target, so readers never see a half-written artifact.
 */
public final class ArtifactStore {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public ArtifactStore(Path dataDir) {
        this(dataDir, Json.newMapper());
    }

    public ArtifactStore(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path resolve(String name) {
        return dataDir.resolve(name);
    }

    public boolean exists(String name) {
        return Files.exists(resolve(name));
    }

    public Path writeJson(String name, Object value) throws IOException {
        return write(resolve(name), objectMapper.writeValueAsBytes(value));
    }

    public Path writeText(String name, String content) throws IOException {
        return write(resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    public <T> T readJson(String name, Class<T> type) throws IOException {
        return readJson(resolve(name), type);
    }

    /**
     * @throws NoSuchFileException if the file does not exist
     */
    public <T> T readJson(Path file, Class<T> type) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return objectMapper.readValue(file.toFile(), type);
    }

    public <T> Optional<T> readJsonIfPresent(String name, Class<T> type) throws IOException {
        var file = resolve(name);
        return Files.exists(file) ? Optional.of(readJson(file, type)) : Optional.empty();
    }

    private Path write(Path target, byte[] content) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        var tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}, replacing in place", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.info("Saved {}", target);
        return target;
    }
}
