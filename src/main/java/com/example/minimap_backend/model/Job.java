package com.example.minimap_backend.model;

import com.example.minimap_backend.util.JobStatus;
import com.example.minimap_backend.util.RenderConfigConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(
        name = "render_job",
        indexes = {
                @Index(name = "idx_render_job_owner_created", columnList = "owner_token, created_at"),
                @Index(name = "idx_render_job_status_completed", columnList = "status, completed_at")
        }
)
public class Job {
    static final int MESSAGE_MAX_LENGTH = 8000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "original_filename", nullable = false, updatable = false, length = 512)
    private String originalFilename;

    @Column(name = "owner_token", nullable = false, updatable = false, length = 128)
    private String ownerToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "message", nullable = false, length = 8192)
    private String message = "";

    @Convert(converter = RenderConfigConverter.class)
    @Column(name = "config", nullable = false, updatable = false, length = 4096)
    private RenderConfig config;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "output_path", length = 1024)
    private String outputPath;

    @Column(name = "deletion_requested", nullable = false)
    private boolean deletionRequested;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    protected Job() {}

    public Job(UUID id, String originalFilename, String ownerToken, RenderConfig config, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.originalFilename = Objects.requireNonNull(originalFilename, "originalFilename");
        this.ownerToken = Objects.requireNonNull(ownerToken, "ownerToken");
        this.config = config == null ? RenderConfig.defaults() : config;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = JobStatus.QUEUED;
    }

    /**
     * Single mutator of the lifecycle fields. {@code completedAt} is stamped the moment the job
     * enters a terminal state and never again; {@code outputPath} is only accepted together
     * with {@link JobStatus#COMPLETED}.
     *
     * @throws IllegalStateException    when the job is already terminal.
     * @throws IllegalArgumentException when an output path accompanies a non-completed status.
     */
    public void transitionTo(JobStatus next, String message, String outputPath, Instant now) {
        Objects.requireNonNull(next, "next");
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.wireName() + "; cannot move to " + next.wireName());
        }
        if (outputPath != null && next != JobStatus.COMPLETED) {
            throw new IllegalArgumentException("output path is only valid for completed jobs");
        }
        if (next == JobStatus.COMPLETED && outputPath == null) {
            throw new IllegalArgumentException("completed jobs require an output path");
        }
        this.status = next;
        this.message = truncate(message);
        if (outputPath != null) {
            this.outputPath = outputPath;
        }
        if (next.isTerminal() && completedAt == null) {
            this.completedAt = Objects.requireNonNull(now, "now");
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isOwnedBy(String token) {
        return token != null && token.equals(ownerToken);
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MESSAGE_MAX_LENGTH ? message : message.substring(0, MESSAGE_MAX_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public String getOwnerToken() {
        return ownerToken;
    }

    public JobStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public RenderConfig getConfig() {
        return config;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public boolean isDeletionRequested() {
        return deletionRequested;
    }

    public void setDeletionRequested(boolean deletionRequested) {
        this.deletionRequested = deletionRequested;
    }

    public Long getVersion() {
        return version;
    }
}
