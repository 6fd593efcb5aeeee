package com.example.minimap_backend.exception;

public abstract class RenderEngineException extends Exception {
    private final String diagnostics;

    protected RenderEngineException(String message, String diagnostics) {
        super(message);
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    /** Captured engine output, already bounded by the renderer. */
    public String getDiagnostics() {
        return diagnostics;
    }
}
