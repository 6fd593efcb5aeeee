package com.example.minimap_backend.dto;

import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.util.JobStatus;

import java.util.UUID;

public record UploadResponse(UUID id, String filename, JobStatus status) {
    public static UploadResponse from(Job job) {
        return new UploadResponse(job.getId(), job.getOriginalFilename(), job.getStatus());
    }
}
