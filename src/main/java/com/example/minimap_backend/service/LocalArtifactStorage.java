package com.example.minimap_backend.service;

import com.example.minimap_backend.dto.PublishedArtifacts;
import com.example.minimap_backend.dto.RenderOutput;
import com.example.minimap_backend.exception.ArtifactMissingException;
import com.example.minimap_backend.exception.StorageException;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.util.ArtifactRole;
import com.example.minimap_backend.util.ReplayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.UUID;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Filesystem layout: {@code uploads/<jobId>/<filename>} holds the replay and is also the engine's
 * working location; published outputs live at {@code outputs/<jobId>.mp4} and {@code outputs/<jobId>.json}.
 */
public class LocalArtifactStorage implements ArtifactStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStorage.class);

    static final String METADATA_EXTENSION = ".json";

    private final Path baseDir;
    private final Path uploadDir;
    private final Path outputDir;

    public LocalArtifactStorage(Path baseDir, String uploadPrefix, String outputPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.uploadDir = this.baseDir.resolve(uploadPrefix).normalize();
        this.outputDir = this.baseDir.resolve(outputPrefix).normalize();

        try {
            Files.createDirectories(uploadDir);
            Files.createDirectories(outputDir);
            LOGGER.info("LocalArtifactStorage ready. base={}, uploads={}, outputs={}", this.baseDir, this.uploadDir, this.outputDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path storeInput(UUID jobId, String filename, InputStream content) {
        Path target = pathFor(jobId, ArtifactRole.INPUT, filename);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(content, target, REPLACE_EXISTING);
            LOGGER.debug("Stored input jobId={} path={} size={}", jobId, target, Files.size(target));
            return target;
        } catch (IOException e) {
            throw new StorageException("Store input failed for job " + jobId, e);
        }
    }

    @Override
    public Path locateInput(UUID jobId, String filename) {
        return pathFor(jobId, ArtifactRole.INPUT, filename);
    }

    @Override
    public PublishedArtifacts publishOutputs(UUID jobId, RenderOutput candidates) {
        Path video = candidates == null ? null : candidates.videoFile();
        if (video == null || !Files.isRegularFile(video)) {
            throw new ArtifactMissingException(video);
        }
        Path videoTarget = pathFor(jobId, ArtifactRole.OUTPUT_VIDEO, null);
        move(video, videoTarget);

        Path metadataTarget = null;
        Path metadata = candidates.metadataFile();
        if (metadata != null && Files.isRegularFile(metadata)) {
            metadataTarget = pathFor(jobId, ArtifactRole.OUTPUT_METADATA, null);
            move(metadata, metadataTarget);
        } else {
            LOGGER.info("No metadata produced jobId={} expected={}", jobId, metadata);
        }
        return new PublishedArtifacts(videoTarget, metadataTarget);
    }

    @Override
    public Path pathFor(UUID jobId, ArtifactRole role, String filename) {
        if (jobId == null) {
            throw new StorageException("jobId is null");
        }
        return switch (role) {
            case INPUT -> safeResolve(uploadDir, jobId + "/" + sanitizeFilename(filename));
            case OUTPUT_VIDEO -> safeResolve(outputDir, jobId + ReplayFiles.VIDEO_EXTENSION);
            case OUTPUT_METADATA -> safeResolve(outputDir, jobId + METADATA_EXTENSION);
        };
    }

    @Override
    public void deleteAll(UUID jobId) {
        deleteIfExists(pathFor(jobId, ArtifactRole.OUTPUT_VIDEO, null));
        deleteIfExists(pathFor(jobId, ArtifactRole.OUTPUT_METADATA, null));
        deleteDirectory(safeResolve(uploadDir, jobId.toString()));
    }

    @Override
    public Path rootUploads() {
        return uploadDir;
    }

    @Override
    public Path rootOutputs() {
        return outputDir;
    }

    /** Strips any directory part so a client-chosen name cannot escape the job directory. */
    static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new StorageException("filename is blank");
        }
        String normalized = filename.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new StorageException("Invalid filename: " + filename);
        }
        return name;
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void move(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            try {
                Files.move(source, target, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Move failed " + source + " -> " + target, e);
        }
    }

    private void deleteIfExists(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    private void deleteDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            deleteIfExists(dir);
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (Files.isDirectory(entry)) {
                    deleteDirectory(entry);
                } else {
                    deleteIfExists(entry);
                }
            }
        } catch (NoSuchFileException e) {
            return;
        } catch (IOException e) {
            throw new StorageException("List failed: " + dir, e);
        }
        deleteIfExists(dir);
    }
}
