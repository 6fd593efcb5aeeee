package com.example.minimap_backend.engine;

import com.example.minimap_backend.dto.RenderOutput;
import com.example.minimap_backend.exception.ArtifactMissingException;
import com.example.minimap_backend.exception.EngineFailureException;
import com.example.minimap_backend.exception.EngineTimeoutException;
import com.example.minimap_backend.model.RenderConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SubprocessRendererTest {

    @TempDir
    Path dir;

    private Path replay;

    @BeforeEach
    void setUp() throws Exception {
        replay = Files.writeString(dir.resolve("battle.wowsreplay"), "replay");
    }

    /** Appended renderer arguments become $1.. of the script; $2 is the replay path. */
    private SubprocessRenderer script(String body, Duration timeout) {
        return new SubprocessRenderer(List.of("sh", "-c", body, "renderer"), dir, timeout, 256);
    }

    @Test
    void buildsCommandFromConfig() {
        SubprocessRenderer renderer = new SubprocessRenderer(List.of("python3", "-m", "render"), dir, Duration.ofMinutes(1), 256);

        List<String> cmd = renderer.buildCommand(replay, new RenderConfig(true, true, false, true, 30, 9, null));

        assertThat(cmd).containsExactly("python3", "-m", "render",
                "--replay", replay.toAbsolutePath().toString(),
                "--anon", "--no-chat", "--team-tracers",
                "--fps", "30", "--quality", "9");
    }

    @Test
    void defaultConfigPassesOnlyFpsAndQuality() {
        SubprocessRenderer renderer = new SubprocessRenderer(List.of("render"), dir, Duration.ofMinutes(1), 256);

        List<String> cmd = renderer.buildCommand(replay, RenderConfig.defaults());

        assertThat(cmd).containsExactly("render", "--replay", replay.toAbsolutePath().toString(),
                "--fps", "20", "--quality", "7");
    }

    @Test
    void successReportsOutputsNextToReplay() throws Exception {
        SubprocessRenderer renderer = script("stem=\"${2%.*}\"; echo v > \"$stem.mp4\"; echo '[]' > \"$stem-builds.json\"", Duration.ofSeconds(30));

        RenderOutput out = renderer.render(replay, RenderConfig.defaults());

        assertThat(out.videoFile()).isEqualTo(dir.resolve("battle.mp4"));
        assertThat(out.metadataFile()).isEqualTo(dir.resolve("battle-builds.json"));
        assertThat(out.videoFile()).exists();
    }

    @Test
    void nonZeroExitCarriesCodeAndStderr() {
        SubprocessRenderer renderer = script("echo 'replay version unsupported' >&2; exit 3", Duration.ofSeconds(30));

        assertThatThrownBy(() -> renderer.render(replay, RenderConfig.defaults()))
                .isInstanceOfSatisfying(EngineFailureException.class, e -> {
                    assertThat(e.getExitCode()).isEqualTo(3);
                    assertThat(e.getMessage()).isEqualTo("Renderer failed with code 3");
                    assertThat(e.getDiagnostics()).contains("replay version unsupported");
                });
    }

    @Test
    void diagnosticsAreBoundedToTail() {
        SubprocessRenderer renderer = script("i=0; while [ $i -lt 200 ]; do echo \"noise line $i\" >&2; i=$((i+1)); done; exit 1", Duration.ofSeconds(30));

        assertThatThrownBy(() -> renderer.render(replay, RenderConfig.defaults()))
                .isInstanceOfSatisfying(EngineFailureException.class, e -> {
                    assertThat(e.getDiagnostics()).endsWith("noise line 199");
                    assertThat(e.getDiagnostics().length()).isLessThan(300);
                });
    }

    @Test
    void timeoutKillsProcess() {
        SubprocessRenderer renderer = script("sleep 30", Duration.ofMillis(300));

        long t0 = System.nanoTime();
        assertThatThrownBy(() -> renderer.render(replay, RenderConfig.defaults()))
                .isInstanceOf(EngineTimeoutException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(20));
    }

    @Test
    void unstartableCommandIsEngineFailure() {
        SubprocessRenderer renderer = new SubprocessRenderer(List.of(dir.resolve("does-not-exist").toString()), dir, Duration.ofSeconds(5), 256);

        assertThatThrownBy(() -> renderer.render(replay, RenderConfig.defaults()))
                .isInstanceOfSatisfying(EngineFailureException.class, e -> assertThat(e.getExitCode()).isEqualTo(-1));
    }

    @Test
    void outputsAreNamedAfterReplayStem() {
        assertThat(SubprocessRenderer.videoFor(Path.of("/x/a.b.wowsreplay"))).isEqualTo(Path.of("/x/a.b.mp4"));
        assertThat(SubprocessRenderer.metadataFor(Path.of("/x/a.wowsreplay"))).isEqualTo(Path.of("/x/a-builds.json"));
    }

    @Test
    void inputNamedLikeTheVideoIsNeverReportedAsOutput() throws Exception {
        Path mp4Input = Files.writeString(dir.resolve("match.mp4"), "REPLAY-BYTES");
        SubprocessRenderer renderer = script("exit 0", Duration.ofSeconds(30));

        assertThatThrownBy(() -> renderer.render(mp4Input, RenderConfig.defaults()))
                .isInstanceOf(ArtifactMissingException.class)
                .hasMessageContaining("match.mp4");
        assertThat(mp4Input).hasContent("REPLAY-BYTES");
    }
}
