package com.example.minimap_backend.dto;

import java.nio.file.Path;

/**
 * Files a successful engine run is expected to have produced in its working location.
 * Neither path is guaranteed to exist; {@code metadataFile} may be null.
 */
public record RenderOutput(Path videoFile, Path metadataFile, String diagnostics) {
}
