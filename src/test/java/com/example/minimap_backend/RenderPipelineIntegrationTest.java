package com.example.minimap_backend;

import com.example.minimap_backend.RenderPipelineTestSupport.FakeRenderer;
import com.example.minimap_backend.config.RetentionProperties;
import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.exception.JobNotFoundException;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.service.JobAccessService;
import com.example.minimap_backend.service.JobService;
import com.example.minimap_backend.service.RetentionSweeper;
import com.example.minimap_backend.service.UploadService;
import com.example.minimap_backend.service.WorkerService;
import com.example.minimap_backend.util.DeletionOutcome;
import com.example.minimap_backend.util.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.example.minimap_backend.RenderPipelineTestSupport.awaitTerminal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(RenderPipelineTestSupport.FakeRendererConfig.class)
class RenderPipelineIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(15);

    @Autowired
    private UploadService uploadService;
    @Autowired
    private JobService jobService;
    @Autowired
    private JobAccessService accessService;
    @Autowired
    private WorkerService workerService;
    @Autowired
    private RetentionSweeper sweeper;
    @Autowired
    private RetentionProperties retentionProperties;
    @Autowired
    private ArtifactStorage storage;
    @Autowired
    private FakeRenderer renderer;

    private String owner;

    @BeforeEach
    void startWorkers() {
        owner = "session-" + UUID.randomUUID();
        renderer.delayMillis = 150;
        workerService.start();
    }

    @AfterEach
    void stopWorkers() {
        workerService.stop();
        retentionProperties.setMaxAge(Duration.ofHours(24));
    }

    private Job submit(String owner, String filename, RenderConfig config) {
        return uploadService.submit(owner, filename, new ByteArrayInputStream("replay".getBytes()), config);
    }

    private static RenderConfig config(int fps, int quality) {
        return new RenderConfig(false, false, false, false, fps, quality, null);
    }

    @Test
    void twoJobsOnTwoWorkersBothComplete() throws Exception {
        Job a = submit(owner, "alpha.wowsreplay", config(20, 7));
        Job b = submit(owner, "bravo.wowsreplay", config(10, 3));

        awaitTerminal(jobService, WAIT, a.getId(), b.getId());

        Job doneA = jobService.get(a.getId());
        Job doneB = jobService.get(b.getId());
        assertThat(doneA.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(doneB.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(doneA.getCompletedAt()).isNotNull();
        assertThat(Files.readString(Path.of(doneA.getOutputPath()))).isEqualTo("fps=20 quality=7");
        assertThat(Files.readString(Path.of(doneB.getOutputPath()))).isEqualTo("fps=10 quality=3");
        assertThat(storage.locateMetadata(a.getId())).isPresent();
    }

    @Test
    void ownersOnlySeeTheirOwnJobs() throws Exception {
        String other = "session-" + UUID.randomUUID();
        Job mine = submit(owner, "mine.wowsreplay", config(20, 7));
        Job theirs = submit(other, "theirs.wowsreplay", config(20, 7));
        awaitTerminal(jobService, WAIT, mine.getId(), theirs.getId());

        List<Job> listed = accessService.listForOwner(Requester.owner(owner));

        assertThat(listed).extracting(Job::getId).containsExactly(mine.getId());
        assertThat(accessService.listForOwner(Requester.owner(other))).extracting(Job::getId).containsExactly(theirs.getId());
    }

    @Test
    void engineFailureIsRecordedOnJob() throws Exception {
        Job job = submit(owner, "broken.wowsreplay", config(20, 7));

        awaitTerminal(jobService, WAIT, job.getId());

        Job failed = jobService.get(job.getId());
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getMessage()).startsWith("Renderer failed with code 1").contains("unsupported replay version");
        assertThat(failed.getOutputPath()).isNull();
        assertThat(failed.getCompletedAt()).isNotNull();
    }

    @Test
    void missingVideoFailsJob() throws Exception {
        Job job = submit(owner, "novideo.wowsreplay", config(20, 7));

        awaitTerminal(jobService, WAIT, job.getId());

        Job failed = jobService.get(job.getId());
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getMessage()).contains("Output file not found");
    }

    @Test
    void deletingCompletedJobRemovesRecordAndFiles() throws Exception {
        Job job = submit(owner, "gone.wowsreplay", config(20, 7));
        awaitTerminal(jobService, WAIT, job.getId());
        Path video = storage.locateOutput(job.getId()).orElseThrow();

        assertThat(accessService.deleteJob(Requester.owner(owner), job.getId())).isEqualTo(DeletionOutcome.DELETED);

        assertThat(jobService.find(job.getId())).isEmpty();
        assertThat(video).doesNotExist();
        assertThat(storage.locateInput(job.getId(), "gone.wowsreplay").getParent()).doesNotExist();
        assertThatThrownBy(() -> accessService.deleteJob(Requester.owner(owner), job.getId()))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void deletingProcessingJobIsDeferredUntilItFinishes() throws Exception {
        renderer.delayMillis = 1_000;
        Job job = submit(owner, "slow.wowsreplay", config(20, 7));
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (jobService.get(job.getId()).getStatus() != JobStatus.PROCESSING && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertThat(accessService.deleteJob(Requester.owner(owner), job.getId())).isEqualTo(DeletionOutcome.DEFERRED);

        deadline = System.nanoTime() + WAIT.toNanos();
        while (jobService.find(job.getId()).isPresent() && System.nanoTime() < deadline) {
            Thread.sleep(25);
        }
        assertThat(jobService.find(job.getId())).isEmpty();
        assertThat(storage.locateOutput(job.getId())).isEmpty();
    }

    @Test
    void deleteAllForOwnerLeavesOtherSessionsAlone() throws Exception {
        String other = "session-" + UUID.randomUUID();
        Job a = submit(owner, "a.wowsreplay", config(20, 7));
        Job b = submit(owner, "b.wowsreplay", config(20, 7));
        Job keep = submit(other, "keep.wowsreplay", config(20, 7));
        awaitTerminal(jobService, WAIT, a.getId(), b.getId(), keep.getId());

        accessService.deleteAllForOwner(Requester.owner(owner));

        assertThat(accessService.listForOwner(Requester.owner(owner))).isEmpty();
        assertThat(jobService.find(keep.getId())).isPresent();
    }

    @Test
    void sweeperPurgesOnlyExpiredJobs() throws Exception {
        renderer.delayMillis = 10;
        Job old = submit(owner, "old.wowsreplay", config(20, 7));
        awaitTerminal(jobService, WAIT, old.getId());
        Thread.sleep(3_000);
        Job fresh = submit(owner, "fresh.wowsreplay", config(20, 7));
        awaitTerminal(jobService, WAIT, fresh.getId());

        retentionProperties.setMaxAge(Duration.ofSeconds(2));
        int purged = sweeper.sweep();

        assertThat(purged).isGreaterThanOrEqualTo(1);
        assertThat(jobService.find(old.getId())).isEmpty();
        assertThat(storage.locateOutput(old.getId())).isEmpty();
        assertThat(jobService.find(fresh.getId())).isPresent();
    }
}
