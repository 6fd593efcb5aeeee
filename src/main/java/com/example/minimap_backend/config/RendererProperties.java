package com.example.minimap_backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * How the external minimap renderer is launched.
 */
@Validated
@ConfigurationProperties(prefix = "renderer")
public class RendererProperties {

    /** Command prefix; the replay path and option flags are appended. */
    @NotEmpty
    private List<String> command = new ArrayList<>(List.of("python3", "-m", "render"));

    /** Directory the renderer is started in. */
    private String workingDir = "../minimap_renderer/src";

    private Duration timeout = Duration.ofHours(2);

    /** Upper bound, in characters, of engine output kept for failure messages. */
    @Min(256)
    private int diagnosticsLimit = 4000;

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getWorkingDir() {
        return workingDir;
    }

    public void setWorkingDir(String workingDir) {
        this.workingDir = workingDir;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getDiagnosticsLimit() {
        return diagnosticsLimit;
    }

    public void setDiagnosticsLimit(int diagnosticsLimit) {
        this.diagnosticsLimit = diagnosticsLimit;
    }
}
