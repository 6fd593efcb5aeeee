package com.example.minimap_backend.engine;

import com.example.minimap_backend.dto.RenderOutput;
import com.example.minimap_backend.engine.Interfaces.Renderer;
import com.example.minimap_backend.exception.ArtifactMissingException;
import com.example.minimap_backend.exception.EngineFailureException;
import com.example.minimap_backend.exception.EngineTimeoutException;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.util.BoundedTextBuffer;
import com.example.minimap_backend.util.ReplayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the minimap renderer as a child process. The renderer writes {@code <stem>.mp4} and
 * {@code <stem>-builds.json} next to the replay it was given.
 */
public class SubprocessRenderer implements Renderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessRenderer.class);

    private final List<String> command;
    private final Path workingDir;
    private final Duration timeout;
    private final int diagnosticsLimit;

    public SubprocessRenderer(List<String> command, Path workingDir, Duration timeout, int diagnosticsLimit) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("renderer command is empty");
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir != null ? workingDir.toAbsolutePath().normalize() : null;
        this.timeout = timeout != null ? timeout : Duration.ofHours(2);
        this.diagnosticsLimit = diagnosticsLimit > 0 ? diagnosticsLimit : 4000;
    }

    @Override
    public RenderOutput render(Path input, RenderConfig config)
            throws EngineFailureException, EngineTimeoutException, InterruptedException {
        if (input == null || !Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input file not found: " + input);
        }
        List<String> cmd = buildCommand(input, config == null ? RenderConfig.defaults() : config);
        LOGGER.info("Renderer command: {}", String.join(" ", cmd));

        ProcessBuilder pb = new ProcessBuilder(cmd).redirectErrorStream(false);
        if (workingDir != null && Files.isDirectory(workingDir)) {
            pb.directory(workingDir.toFile());
        } else if (workingDir != null) {
            LOGGER.warn("Renderer working dir missing, using current dir: {}", workingDir);
        }

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new EngineFailureException(-1, "Could not start renderer: " + e.getMessage());
        }

        BoundedTextBuffer outBuf = new BoundedTextBuffer(diagnosticsLimit);
        BoundedTextBuffer errBuf = new BoundedTextBuffer(diagnosticsLimit);
        Thread tOut = drain(p.getInputStream(), outBuf, "renderer-out");
        Thread tErr = drain(p.getErrorStream(), errBuf, "renderer-err");

        boolean finished;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            destroy(p);
            throw e;
        }
        if (!finished) {
            destroy(p);
            awaitDrain(tOut, tErr);
            throw new EngineTimeoutException(timeout, diagnostics(errBuf, outBuf));
        }
        awaitDrain(tOut, tErr);

        int exit = p.exitValue();
        if (exit != 0) {
            throw new EngineFailureException(exit, diagnostics(errBuf, outBuf));
        }

        Path video = videoFor(input);
        if (video.equals(input.toAbsolutePath().normalize())) {
            // the replay itself would be published as the rendered video
            throw new ArtifactMissingException(video);
        }
        return new RenderOutput(video, metadataFor(input), diagnostics(errBuf, outBuf));
    }

    List<String> buildCommand(Path input, RenderConfig config) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add("--replay");
        cmd.add(input.toAbsolutePath().toString());
        if (config.anon()) cmd.add("--anon");
        if (config.noChat()) cmd.add("--no-chat");
        if (config.noLogs()) cmd.add("--no-logs");
        if (config.teamTracers()) cmd.add("--team-tracers");
        cmd.add("--fps");
        cmd.add(String.valueOf(config.fps()));
        cmd.add("--quality");
        cmd.add(String.valueOf(config.quality()));
        return cmd;
    }

    static Path videoFor(Path input) {
        Path abs = input.toAbsolutePath().normalize();
        return abs.resolveSibling(ReplayFiles.videoName(abs.getFileName().toString()));
    }

    static Path metadataFor(Path input) {
        Path abs = input.toAbsolutePath().normalize();
        return abs.resolveSibling(ReplayFiles.metadataName(abs.getFileName().toString()));
    }

    private Thread drain(InputStream stream, BoundedTextBuffer sink, String name) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.debug("[{}] {}", name, line);
                    sink.appendLine(line);
                });
            } catch (IOException | UncheckedIOException e) {
                LOGGER.debug("[{}] stream closed: {}", name, e.toString());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void awaitDrain(Thread... threads) throws InterruptedException {
        for (Thread t : threads) {
            t.join(TimeUnit.SECONDS.toMillis(5));
        }
    }

    private static void destroy(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
    }

    private static String diagnostics(BoundedTextBuffer errBuf, BoundedTextBuffer outBuf) {
        return errBuf.isBlank() ? outBuf.toString() : errBuf.toString();
    }
}
