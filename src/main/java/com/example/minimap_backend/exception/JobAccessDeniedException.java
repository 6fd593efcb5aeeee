package com.example.minimap_backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class JobAccessDeniedException extends ResponseStatusException {
    public JobAccessDeniedException() {
        super(HttpStatus.FORBIDDEN, "ACCESS_DENIED");
    }
}
