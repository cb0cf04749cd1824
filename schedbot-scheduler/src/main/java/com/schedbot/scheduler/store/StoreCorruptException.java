package com.schedbot.scheduler.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The job document exists but cannot be parsed. Never repaired automatically.
 */
public class StoreCorruptException extends IOException {

    private final Path path;

    public StoreCorruptException(Path path, Throwable cause) {
        super("Job store " + path + " is malformed: " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
