package com.example.minimap_backend.dto;

import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.util.JobStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID id,
        String filename,
        JobStatus status,
        String message,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt,
        int fps,
        int quality
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getOriginalFilename(),
                job.getStatus(),
                job.getMessage(),
                job.getCreatedAt(),
                job.getCompletedAt(),
                job.getConfig().fps(),
                job.getConfig().quality()
        );
    }
}
