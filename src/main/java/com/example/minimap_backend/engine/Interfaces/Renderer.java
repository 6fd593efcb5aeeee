package com.example.minimap_backend.engine.Interfaces;

import com.example.minimap_backend.dto.RenderOutput;
import com.example.minimap_backend.exception.RenderEngineException;
import com.example.minimap_backend.model.RenderConfig;

import java.nio.file.Path;

/**
 * The external rendering engine. A call may run for hours; implementations must honor thread
 * interruption and their own timeout.
 */
public interface Renderer {

    /**
     * @return where the engine wrote its outputs. The files are not guaranteed to exist.
     * @throws com.example.minimap_backend.exception.EngineFailureException  engine reported failure.
     * @throws com.example.minimap_backend.exception.EngineTimeoutException  engine exceeded its time budget.
     */
    RenderOutput render(Path input, RenderConfig config) throws RenderEngineException, InterruptedException;
}
