package com.example.minimap_backend.exception;

import java.time.Duration;

public class EngineTimeoutException extends RenderEngineException {
    private final Duration timeout;

    public EngineTimeoutException(Duration timeout, String diagnostics) {
        super("Renderer timed out after " + timeout, diagnostics);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
