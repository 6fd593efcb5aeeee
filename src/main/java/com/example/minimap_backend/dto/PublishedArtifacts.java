package com.example.minimap_backend.dto;

import java.nio.file.Path;

/** Stable, job-addressed locations of the published outputs. {@code metadataPath} may be null. */
public record PublishedArtifacts(Path videoPath, Path metadataPath) {
}
