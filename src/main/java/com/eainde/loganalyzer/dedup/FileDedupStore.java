package com.eainde.loganalyzer.dedup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;

/**
 * {@link DedupStore} kept in a JSON object of {@code key -> first seen instant}.
 * The file is re-read on every call so several processes may share it; the replacement is atomic.
 */
@Slf4j
public class FileDedupStore implements DedupStore {

    private final ObjectMapper objectMapper;
    private final Path file;
    private final Clock clock;

    public FileDedupStore(ObjectMapper objectMapper, Path file, Clock clock) {
        this.objectMapper = objectMapper;
        this.file = file;
        this.clock = clock;
    }

    @Override
    public synchronized boolean checkAndSet(String key) {
        ObjectNode keys = load();
        if (keys.has(key)) {
            return true;
        }
        keys.put(key, Instant.now(clock).toString());
        save(keys);
        return false;
    }

    private ObjectNode load() {
        if (!Files.exists(file)) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root instanceof ObjectNode) {
                return (ObjectNode) root;
            }
            log.warn("Dedup store {} is not a JSON object, starting fresh", file);
            return objectMapper.createObjectNode();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read dedup store " + file, e);
        }
    }

    private void save(ObjectNode keys) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + file.getFileName() + "-", ".tmp");
            Files.writeString(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(keys),
                    StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write dedup store " + file, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not delete temporary file {}", tmp, e);
                }
            }
        }
    }
}
