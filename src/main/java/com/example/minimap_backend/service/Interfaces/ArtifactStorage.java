package com.example.minimap_backend.service.Interfaces;

import com.example.minimap_backend.dto.PublishedArtifacts;
import com.example.minimap_backend.dto.RenderOutput;
import com.example.minimap_backend.util.ArtifactRole;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps a job to its input and output files and owns their creation, relocation and deletion.
 * Implementations must be safe for concurrent use; every operation is idempotent or order-insensitive.
 */
public interface ArtifactStorage {

    /** Persists the uploaded replay and returns where the engine should read it. */
    Path storeInput(UUID jobId, String filename, InputStream content);

    Path locateInput(UUID jobId, String filename);

    /**
     * Moves the engine's output files to their job-addressed location.
     *
     * @throws com.example.minimap_backend.exception.ArtifactMissingException when the video is absent.
     */
    PublishedArtifacts publishOutputs(UUID jobId, RenderOutput candidates);

    /** Stable path of an artifact; the file may not exist. {@code filename} is only used for the input. */
    Path pathFor(UUID jobId, ArtifactRole role, String filename);

    default Optional<Path> locateOutput(UUID jobId) {
        return existing(pathFor(jobId, ArtifactRole.OUTPUT_VIDEO, null));
    }

    default Optional<Path> locateMetadata(UUID jobId) {
        return existing(pathFor(jobId, ArtifactRole.OUTPUT_METADATA, null));
    }

    /** Removes input, output video and metadata. Absent files are ignored; repeating is a no-op. */
    void deleteAll(UUID jobId);

    Path rootUploads();

    Path rootOutputs();

    private static Optional<Path> existing(Path path) {
        return path != null && Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }
}
