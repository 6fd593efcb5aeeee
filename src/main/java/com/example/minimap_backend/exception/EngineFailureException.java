package com.example.minimap_backend.exception;

public class EngineFailureException extends RenderEngineException {
    private final int exitCode;

    public EngineFailureException(int exitCode, String diagnostics) {
        super("Renderer failed with code " + exitCode, diagnostics);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
