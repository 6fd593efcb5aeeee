package com.example.minimap_backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class JobNotFoundException extends ResponseStatusException {
    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
