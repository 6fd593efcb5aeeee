package com.example.minimap_backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * A published artifact was requested but is not on disk (for instance metadata the engine never wrote).
 */
public class ArtifactUnavailableException extends ResponseStatusException {
    public ArtifactUnavailableException(String reason) {
        super(HttpStatus.NOT_FOUND, reason);
    }
}
