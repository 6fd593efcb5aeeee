package com.example.minimap_backend.service;

import com.example.minimap_backend.exception.StorageException;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.util.ReplayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Accepts a replay and its options, persists both and hands the job to the work queue.
 */
@Service
public class UploadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);

    private final ArtifactStorage artifactStorage;
    private final JobService jobService;
    private final WorkQueue workQueue;

    public UploadService(ArtifactStorage artifactStorage, JobService jobService, WorkQueue workQueue) {
        this.artifactStorage = artifactStorage;
        this.jobService = jobService;
        this.workQueue = workQueue;
    }

    public Job submit(String ownerToken, MultipartFile file, RenderConfig config) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_EMPTY");
        }
        try (InputStream in = file.getInputStream()) {
            return submit(ownerToken, file.getOriginalFilename(), in, config);
        } catch (IOException e) {
            throw new StorageException("Could not read upload " + file.getOriginalFilename(), e);
        }
    }

    /**
     * Stores the input, creates the job record and enqueues it. Not transactional: the id is only
     * enqueued once the record is committed, so a worker never dequeues an id it cannot see.
     */
    public Job submit(String ownerToken, String filename, InputStream content, RenderConfig config) {
        if (ownerToken == null || ownerToken.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "OWNER_REQUIRED");
        }
        RenderConfig effective = config == null ? RenderConfig.defaults() : config;
        validate(effective);
        String name;
        try {
            name = LocalArtifactStorage.sanitizeFilename(filename);
        } catch (StorageException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_FILENAME");
        }
        if (!ReplayFiles.isReplay(name)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_FILENAME");
        }

        UUID jobId = UUID.randomUUID();
        try {
            artifactStorage.storeInput(jobId, name, content);
        } catch (StorageException e) {
            LOGGER.warn("SUBMIT store failed, removing partial input jobId={} err={}", jobId, e.toString());
            discardInput(jobId);
            throw e;
        }
        Job job;
        try {
            job = jobService.create(jobId, name, ownerToken, effective);
        } catch (RuntimeException e) {
            LOGGER.warn("SUBMIT record failed, removing input jobId={}", jobId);
            discardInput(jobId);
            throw e;
        }
        workQueue.enqueue(jobId);
        LOGGER.info("SUBMIT jobId={} file={} fps={} quality={} webhook={}",
                jobId, name, effective.fps(), effective.quality(), effective.hasWebhook());
        return job;
    }

    private void discardInput(UUID jobId) {
        try {
            artifactStorage.deleteAll(jobId);
        } catch (StorageException cleanup) {
            LOGGER.error("SUBMIT could not remove input jobId={} err={}", jobId, cleanup.toString());
        }
    }

    static void validate(RenderConfig config) {
        if (config.quality() < RenderConfig.MIN_QUALITY || config.quality() > RenderConfig.MAX_QUALITY) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "QUALITY_OUT_OF_RANGE");
        }
        if (config.fps() < RenderConfig.MIN_FPS || config.fps() > RenderConfig.MAX_FPS) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FPS_OUT_OF_RANGE");
        }
        String url = config.discordWebhookUrl();
        if (url != null && !(url.startsWith("https://") || url.startsWith("http://"))) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_WEBHOOK_URL");
        }
    }
}
