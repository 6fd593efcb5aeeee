package com.example.minimap_backend.service;

import com.example.minimap_backend.config.WorkerExecutorProperties;
import com.example.minimap_backend.dto.PublishedArtifacts;
import com.example.minimap_backend.dto.RenderOutput;
import com.example.minimap_backend.engine.Interfaces.Renderer;
import com.example.minimap_backend.exception.ArtifactMissingException;
import com.example.minimap_backend.exception.JobNotFoundException;
import com.example.minimap_backend.exception.RenderEngineException;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.service.notification.WebhookNotifier;
import com.example.minimap_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Future;

/**
 * Runs {@code worker.pool-size} loops that take job ids from the {@link WorkQueue} and drive each
 * job from queued to completed or failed. A job is only worked on by the loop that won
 * {@link JobService#claim(UUID)}.
 */
@Service
public class WorkerService implements SmartLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);
    static final String INTERRUPTED_BY_RESTART = "Interrupted by service restart";

    private final JobService jobService;
    private final WorkQueue workQueue;
    private final ArtifactStorage storage;
    private final Renderer renderer;
    private final JobCleanupService cleanupService;
    private final WebhookNotifier notifier;
    private final AsyncTaskExecutor workerExecutor;
    private final WorkerExecutorProperties workerProperties;

    private final List<Future<?>> loops = new ArrayList<>();
    private volatile boolean running;

    public WorkerService(JobService jobService, WorkQueue workQueue, ArtifactStorage storage, Renderer renderer, JobCleanupService cleanupService, WebhookNotifier notifier, @Qualifier("workerTaskExecutor") AsyncTaskExecutor workerExecutor, WorkerExecutorProperties workerProperties) {
        this.jobService = jobService;
        this.workQueue = workQueue;
        this.storage = storage;
        this.renderer = renderer;
        this.cleanupService = cleanupService;
        this.notifier = notifier;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        recover();
        running = true;
        int workers = Math.max(1, workerProperties.getPoolSize());
        for (int i = 0; i < workers; i++) {
            loops.add(workerExecutor.submit(this::loop));
        }
        LOGGER.info("Worker pool started workers={} queued={}", workers, workQueue.size());
    }

    @Override
    public synchronized void stop() {
        running = false;
        loops.forEach(f -> f.cancel(true));
        loops.clear();
        LOGGER.info("Worker pool stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return workerProperties.isAutoStart();
    }

    public int activeWorkers() {
        return running ? loops.size() : 0;
    }

    /**
     * Jobs left processing by a previous run cannot be resumed: their engine process is gone.
     * Queued jobs go back on the queue in creation order.
     */
    void recover() {
        for (Job job : jobService.findByStatus(JobStatus.PROCESSING)) {
            try {
                Job failed = jobService.markFailed(job.getId(), INTERRUPTED_BY_RESTART);
                LOGGER.warn("RECOVERY failed interrupted jobId={}", job.getId());
                if (failed.isDeletionRequested()) {
                    cleanupService.purge(job.getId());
                }
            } catch (RuntimeException e) {
                LOGGER.error("RECOVERY could not fail jobId={}: {}", job.getId(), e.toString(), e);
            }
        }
        List<Job> queued = jobService.findByStatus(JobStatus.QUEUED);
        queued.forEach(job -> workQueue.enqueue(job.getId()));
        if (!queued.isEmpty()) {
            LOGGER.info("RECOVERY re-enqueued count={}", queued.size());
        }
    }

    private void loop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            UUID jobId;
            try {
                jobId = workQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                process(jobId);
            } catch (Exception e) {
                // store unavailable or similar; the loop must survive
                LOGGER.error("Worker loop error jobId={}: {}", jobId, e.toString(), e);
            }
        }
        LOGGER.debug("Worker loop exiting thread={}", Thread.currentThread().getName());
    }

    /**
     * Processes one dequeued job id end to end. Never throws for job-level failures; those are
     * recorded on the job.
     */
    public void process(UUID jobId) {
        Optional<Job> found = jobService.find(jobId);
        if (found.isEmpty()) {
            LOGGER.info("JOB DISCARDED jobId={} (deleted before processing)", jobId);
            return;
        }
        if (!jobService.claim(jobId)) {
            LOGGER.warn("JOB SKIPPED jobId={} status={} (not claimable)", jobId, found.get().getStatus());
            return;
        }
        Job job = found.get();
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} file={} thread={}", jobId, job.getOriginalFilename(), Thread.currentThread().getName());

        Job finished;
        try {
            finished = run(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = failSafely(jobId, INTERRUPTED_BY_RESTART);
        } catch (Exception e) {
            LOGGER.error("JOB ERROR jobId={}: {}", jobId, e.toString(), e);
            finished = failSafely(jobId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (finished == null) {
            return;
        }
        LOGGER.info("JOB {} jobId={} in={}ms", finished.getStatus() == JobStatus.COMPLETED ? "DONE" : "FAILED",
                jobId, (System.nanoTime() - t0) / 1_000_000);
        afterTerminal(finished);
    }

    private Job run(Job job) throws InterruptedException {
        UUID jobId = job.getId();
        Path input = storage.locateInput(jobId, job.getOriginalFilename());
        PublishedArtifacts published;
        try {
            RenderOutput output = renderer.render(input, job.getConfig());
            published = storage.publishOutputs(jobId, output);
        } catch (RenderEngineException e) {
            return jobService.markFailed(jobId, failureMessage(e));
        } catch (ArtifactMissingException e) {
            return jobService.markFailed(jobId, e.getMessage());
        }
        try {
            return jobService.markCompleted(jobId, published.videoPath().toString());
        } catch (JobNotFoundException e) {
            LOGGER.warn("JOB VANISHED jobId={} during completion, removing outputs", jobId);
            storage.deleteAll(jobId);
            return null;
        }
    }

    private Job failSafely(UUID jobId, String message) {
        try {
            return jobService.markFailed(jobId, message);
        } catch (RuntimeException e) {
            LOGGER.error("Could not record failure jobId={} message={}: {}", jobId, message, e.toString());
            return null;
        }
    }

    private void afterTerminal(Job job) {
        if (job.isDeletionRequested()) {
            cleanupService.purge(job.getId());
            return;
        }
        if (job.getStatus() == JobStatus.COMPLETED && job.getConfig().hasWebhook()) {
            Path metadata = storage.locateMetadata(job.getId()).orElse(null);
            notifier.dispatchAsync(job.getConfig().discordWebhookUrl(), job, metadata);
        }
    }

    static String failureMessage(RenderEngineException e) {
        String diagnostics = e.getDiagnostics();
        if (diagnostics == null || diagnostics.isBlank()) {
            return e.getMessage();
        }
        return e.getMessage() + ": " + diagnostics.strip();
    }
}
