package com.maildesk.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.maildesk.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON state file with whole-file replace on every write.
 * The new content goes to a sibling temp file first, then replaces the target,
 * so a crash mid-write leaves either the old or the new content.
 */
@Slf4j
class JsonStateFile {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;

    JsonStateFile(Path path) {
        this.path = path;
    }

    Path getPath() {
        return path;
    }

    /**
     * @return the stored value, or null when the file does not exist yet
     * @throws StorageException when the file exists but cannot be read
     */
    <T> T read(TypeReference<T> type) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new StorageException("Cannot read state file " + path, e);
        }
    }

    void write(Object value) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot write state file " + path, e);
        }
        log.trace("State file flushed: {}", path);
    }
}
