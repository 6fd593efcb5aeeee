package com.example.minimap_backend.service;

import com.example.minimap_backend.config.RetentionProperties;
import com.example.minimap_backend.dto.DeleteAllResponse;
import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.dto.RetentionPolicyResponse;
import com.example.minimap_backend.exception.ArtifactUnavailableException;
import com.example.minimap_backend.exception.JobAccessDeniedException;
import com.example.minimap_backend.exception.JobNotCompletedException;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.util.DeletionOutcome;
import com.example.minimap_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Read and delete operations on jobs, scoped to the requester. Non-admin callers only see jobs
 * created with their own owner token.
 */
@Service
public class JobAccessService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobAccessService.class);

    private final JobService jobService;
    private final ArtifactStorage storage;
    private final JobCleanupService cleanupService;
    private final RetentionProperties retentionProperties;

    public JobAccessService(JobService jobService, ArtifactStorage storage, JobCleanupService cleanupService, RetentionProperties retentionProperties) {
        this.jobService = jobService;
        this.storage = storage;
        this.cleanupService = cleanupService;
        this.retentionProperties = retentionProperties;
    }

    public Job getStatus(Requester requester, UUID jobId) {
        return authorize(requester, jobService.get(jobId));
    }

    public List<Job> listForOwner(Requester requester) {
        if (requester.ownerToken() == null) {
            return List.of();
        }
        return jobService.listByOwner(requester.ownerToken());
    }

    public List<Job> listAll(Requester requester) {
        requireAdmin(requester);
        return jobService.listAll();
    }

    /**
     * @throws JobNotCompletedException     when the job has no output yet.
     * @throws ArtifactUnavailableException when the video is gone from disk.
     */
    public Path fetchOutput(Requester requester, UUID jobId) {
        Job job = completed(requester, jobId);
        return storage.locateOutput(job.getId())
                .orElseThrow(() -> new ArtifactUnavailableException("OUTPUT_NOT_FOUND"));
    }

    public Path fetchMetadata(Requester requester, UUID jobId) {
        Job job = completed(requester, jobId);
        return storage.locateMetadata(job.getId())
                .orElseThrow(() -> new ArtifactUnavailableException("METADATA_NOT_FOUND"));
    }

    public DeletionOutcome deleteJob(Requester requester, UUID jobId) {
        Job job = authorize(requester, jobService.get(jobId));
        DeletionOutcome outcome = cleanupService.delete(job);
        LOGGER.info("DELETE jobId={} outcome={} admin={}", jobId, outcome, requester.admin());
        return outcome;
    }

    public DeleteAllResponse deleteAllForOwner(Requester requester) {
        return deleteEach(listForOwner(requester));
    }

    public DeleteAllResponse deleteAll(Requester requester) {
        requireAdmin(requester);
        return deleteEach(jobService.listAll());
    }

    public RetentionPolicyResponse getRetentionPolicy() {
        return RetentionPolicyResponse.of(retentionProperties.isEnabled(), retentionProperties.getMaxAge());
    }

    private DeleteAllResponse deleteEach(List<Job> jobs) {
        int deleted = 0;
        int deferred = 0;
        for (Job job : jobs) {
            if (cleanupService.delete(job) == DeletionOutcome.DEFERRED) {
                deferred++;
            } else {
                deleted++;
            }
        }
        LOGGER.info("DELETE ALL deleted={} deferred={}", deleted, deferred);
        return new DeleteAllResponse(deleted, deferred);
    }

    private Job completed(Requester requester, UUID jobId) {
        Job job = authorize(requester, jobService.get(jobId));
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotCompletedException();
        }
        return job;
    }

    private static Job authorize(Requester requester, Job job) {
        if (requester.admin() || job.isOwnedBy(requester.ownerToken())) {
            return job;
        }
        throw new JobAccessDeniedException();
    }

    private static void requireAdmin(Requester requester) {
        if (!requester.admin()) {
            throw new JobAccessDeniedException();
        }
    }
}
