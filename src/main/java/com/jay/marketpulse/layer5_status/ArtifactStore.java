package com.jay.marketpulse.layer5_status;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON files under the data directory.
 * Writes go to a temp file that is then moved over the target, so a reader sees either the
 * old or the new document. Reads treat a missing or unparsable file as absent.
 */
@Slf4j
public class ArtifactStore {

    private final Path dataDir;
    private final ObjectMapper mapper;

    public ArtifactStore(Path dataDir) {
        this.dataDir = dataDir;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path resolve(String name) {
        return dataDir.resolve(name);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /** @throws PersistenceException when the document cannot be written */
    public void write(String name, Object value) {
        Path target = resolve(name);
        Path tmp = null;
        try {
            Files.createDirectories(dataDir);
            tmp = Files.createTempFile(dataDir, name + ".", ".tmp");
            mapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("ArtifactStore: wrote {}", target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to write " + target, e);
        }
    }

    public <T> Optional<T> read(String name, Class<T> type) {
        return read(name, mapper.constructType(type));
    }

    public <T> Optional<T> read(String name, TypeReference<T> type) {
        return read(name, mapper.getTypeFactory().constructType(type));
    }

    public Optional<JsonNode> readTree(String name) {
        return read(name, JsonNode.class);
    }

    /**
     * Read for read-modify-write callers: a missing file is empty, an unparsable one is an error.
     *
     * @throws PersistenceException when the file exists but cannot be read
     */
    public <T> Optional<T> readStrict(String name, TypeReference<T> type) {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), mapper.getTypeFactory().constructType(type)));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }

    private <T> Optional<T> read(String name, JavaType type) {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("ArtifactStore: unreadable {} treated as absent: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("ArtifactStore: could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
