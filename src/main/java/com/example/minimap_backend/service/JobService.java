package com.example.minimap_backend.service;

import com.example.minimap_backend.exception.JobNotFoundException;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.repository.JobRepository;
import com.example.minimap_backend.util.JobStatus;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of every job. Writes to one job are serialized through a row lock; different
 * jobs never contend.
 */
@Service
public class JobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepo;
    private final Clock clock;

    public JobService(JobRepository jobRepo, Clock clock) {
        this.jobRepo = jobRepo;
        this.clock = clock;
    }

    @Transactional
    public Job create(UUID id, String filename, String ownerToken, RenderConfig config) {
        Job job = new Job(id, filename, ownerToken, config, clock.instant());
        jobRepo.save(job);
        LOGGER.info("JOB CREATED jobId={} file={} owner={}", id, filename, ownerToken);
        return job;
    }

    @Transactional(readOnly = true)
    public Optional<Job> find(UUID id) {
        return jobRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public Job get(UUID id) {
        return jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<Job> listByOwner(String ownerToken) {
        return jobRepo.findByOwnerTokenOrderByCreatedAtDesc(ownerToken);
    }

    @Transactional(readOnly = true)
    public List<Job> listAll() {
        return jobRepo.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<Job> findByStatus(JobStatus status) {
        return jobRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    /**
     * Moves a queued job to processing. Only the caller that gets {@code true} owns the job.
     */
    @Transactional
    public boolean claim(UUID id) {
        return jobRepo.markProcessing(id, "Rendering") == 1;
    }

    /**
     * @throws JobNotFoundException  when the job does not exist.
     * @throws IllegalStateException when the job already reached a terminal state.
     */
    @Transactional
    public Job updateStatus(UUID id, JobStatus status, @Nullable String message, @Nullable String outputPath) {
        Job job = jobRepo.findByIdForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
        job.transitionTo(status, message, outputPath, clock.instant());
        LOGGER.info("JOB {} jobId={} message={}", status.name(), id, job.getMessage());
        return job;
    }

    @Transactional
    public Job markCompleted(UUID id, String outputPath) {
        return updateStatus(id, JobStatus.COMPLETED, "Render complete", outputPath);
    }

    @Transactional
    public Job markFailed(UUID id, String message) {
        return updateStatus(id, JobStatus.FAILED, message == null || message.isBlank() ? "unknown error" : message, null);
    }

    /**
     * Flags a non-terminal job for deletion by its worker.
     *
     * @return {@code false} when the job is already terminal (or gone) and can be purged directly.
     */
    @Transactional
    public boolean requestDeletion(UUID id) {
        Optional<Job> locked = jobRepo.findByIdForUpdate(id);
        if (locked.isEmpty() || locked.get().isTerminal()) {
            return false;
        }
        locked.get().setDeletionRequested(true);
        LOGGER.info("JOB DELETE DEFERRED jobId={} status={}", id, locked.get().getStatus());
        return true;
    }

    @Transactional
    public boolean deleteIfQueued(UUID id) {
        return jobRepo.deleteIfQueued(id) == 1;
    }

    @Transactional
    public boolean delete(UUID id) {
        return jobRepo.purgeById(id) == 1;
    }

    @Transactional(readOnly = true)
    public List<Job> listTerminalOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        return jobRepo.findByStatusInAndCompletedAtBefore(JobStatus.TERMINAL, cutoff);
    }
}
