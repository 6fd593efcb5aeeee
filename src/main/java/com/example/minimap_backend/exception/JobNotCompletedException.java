package com.example.minimap_backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class JobNotCompletedException extends ResponseStatusException {
    public JobNotCompletedException() {
        super(HttpStatus.BAD_REQUEST, "JOB_NOT_COMPLETED");
    }
}
