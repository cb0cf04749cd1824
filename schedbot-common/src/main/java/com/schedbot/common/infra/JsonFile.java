package com.schedbot.common.infra;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file load/save with replace-on-write semantics.
 * <p>
 * Writes go to a sibling temp file that is then moved over the target, so a
 * crash mid-write leaves the previous document intact.
 */
public final class JsonFile {

    private JsonFile() {
    }

    /**
     * Read and bind a JSON file. Parse errors propagate; callers decide whether
     * a malformed file is fatal.
     */
    public static <T> T read(ObjectMapper mapper, Path path, Class<T> type) throws IOException {
        return mapper.readValue(Files.readString(path), type);
    }

    /**
     * Serialize {@code data} and atomically replace {@code path} with it.
     */
    public static void write(ObjectMapper mapper, Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, mapper.writeValueAsString(data) + "\n");
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
