package com.umls.sync.extract;

import java.nio.file.Path;

/**
 * Thrown when a required release file is missing or unreadable.
 */
public class SourceUnavailableException extends ExtractionException {

    private final transient Path path;

    public SourceUnavailableException(Path path) {
        super("Required source file not found: " + path);
        this.path = path;
    }

    public SourceUnavailableException(Path path, Throwable cause) {
        super("Unable to read source file: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
