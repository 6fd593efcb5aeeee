package com.example.minimap_backend.service;

import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.util.DeletionOutcome;
import com.example.minimap_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Removes jobs together with their files. Files go first so an interrupted purge leaves a record
 * that the next attempt can finish.
 */
@Service
public class JobCleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobCleanupService.class);

    private final JobService jobService;
    private final ArtifactStorage artifactStorage;

    public JobCleanupService(JobService jobService, ArtifactStorage artifactStorage) {
        this.jobService = jobService;
        this.artifactStorage = artifactStorage;
    }

    /** Unconditional removal of artifacts and record. Safe to repeat. */
    public void purge(UUID jobId) {
        artifactStorage.deleteAll(jobId);
        boolean removed = jobService.delete(jobId);
        LOGGER.info("JOB PURGED jobId={} recordRemoved={}", jobId, removed);
    }

    /**
     * Deletes a job on behalf of a caller. A job still being rendered is flagged and purged by its
     * worker once it finishes.
     */
    public DeletionOutcome delete(Job job) {
        UUID jobId = job.getId();
        if (job.isTerminal()) {
            purge(jobId);
            return DeletionOutcome.DELETED;
        }
        if (job.getStatus() == JobStatus.QUEUED && jobService.deleteIfQueued(jobId)) {
            artifactStorage.deleteAll(jobId);
            LOGGER.info("JOB DELETED while queued jobId={}", jobId);
            return DeletionOutcome.DELETED;
        }
        if (jobService.requestDeletion(jobId)) {
            return DeletionOutcome.DEFERRED;
        }
        // finished (or vanished) between our read and the lock
        purge(jobId);
        return DeletionOutcome.DELETED;
    }
}
