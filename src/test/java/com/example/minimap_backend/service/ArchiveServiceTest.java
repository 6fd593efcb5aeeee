package com.example.minimap_backend.service;

import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.util.JobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.server.ResponseStatusException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArchiveServiceTest {

    @TempDir
    Path dir;

    @Mock
    private JobAccessService accessService;
    @Mock
    private ArtifactStorage storage;
    @InjectMocks
    private ArchiveService archiveService;

    private final Requester alice = Requester.owner("alice");

    private Job completed(String filename) throws Exception {
        Job job = new Job(UUID.randomUUID(), filename, "alice", RenderConfig.defaults(), Instant.EPOCH);
        Path video = Files.writeString(dir.resolve(job.getId() + ".mp4"), "video-" + filename);
        job.transitionTo(JobStatus.COMPLETED, "ok", video.toString(), Instant.EPOCH);
        when(storage.locateOutput(job.getId())).thenReturn(Optional.of(video));
        return job;
    }

    @Test
    void zipsCompletedVideosWithDistinctNames() throws Exception {
        Job first = completed("game.wowsreplay");
        Job second = completed("game.wowsreplay");
        Job queued = new Job(UUID.randomUUID(), "other.wowsreplay", "alice", RenderConfig.defaults(), Instant.EPOCH);
        when(accessService.listForOwner(alice)).thenReturn(List.of(first, queued, second));

        Map<String, Path> entries = archiveService.entriesFor(alice);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        archiveService.writeArchive(entries, out);

        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(out.toByteArray()))) {
            ZipEntry e;
            while ((e = zip.getNextEntry()) != null) {
                names.add(e.getName());
            }
        }
        assertThat(names).containsExactly("game.mp4", "game (1).mp4");
    }

    @Test
    void videoPurgedAfterListingIsLeftOut() throws Exception {
        Job kept = completed("kept.wowsreplay");
        Job purged = completed("purged.wowsreplay");
        when(accessService.listForOwner(alice)).thenReturn(List.of(kept, purged));

        Map<String, Path> entries = archiveService.entriesFor(alice);
        Files.delete(entries.get("purged.mp4"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        archiveService.writeArchive(entries, out);

        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(out.toByteArray()))) {
            ZipEntry e;
            while ((e = zip.getNextEntry()) != null) {
                names.add(e.getName());
                assertThat(new String(zip.readAllBytes())).isEqualTo("video-kept.wowsreplay");
            }
        }
        assertThat(names).containsExactly("kept.mp4");
    }

    @Test
    void noCompletedJobsIsNotFound() {
        Job queued = new Job(UUID.randomUUID(), "other.wowsreplay", "alice", RenderConfig.defaults(), Instant.EPOCH);
        when(accessService.listForOwner(alice)).thenReturn(List.of(queued));

        assertThatThrownBy(() -> archiveService.entriesFor(alice))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("NO_COMPLETED_JOBS");
    }

    @Test
    void uniqueNameCountsUp() {
        Set<String> used = new HashSet<>();

        assertThat(ArchiveService.uniqueName("a", used)).isEqualTo("a.mp4");
        assertThat(ArchiveService.uniqueName("a", used)).isEqualTo("a (1).mp4");
        assertThat(ArchiveService.uniqueName("a", used)).isEqualTo("a (2).mp4");
    }
}
