package com.example.minimap_backend.exception;

import java.nio.file.Path;

/**
 * The engine reported success but its primary output is not on disk.
 */
public class ArtifactMissingException extends StorageException {

    public ArtifactMissingException(Path expected) {
        super("Output file not found after rendering: " + (expected == null ? "<unknown>" : expected.getFileName()));
    }
}
