package com.example.minimap_backend.service;

import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.util.JobStatus;
import com.example.minimap_backend.util.ReplayFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Bundles an owner's completed videos into a single ZIP download.
 */
@Service
public class ArchiveService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveService.class);

    private final JobAccessService accessService;
    private final ArtifactStorage storage;

    public ArchiveService(JobAccessService accessService, ArtifactStorage storage) {
        this.accessService = accessService;
        this.storage = storage;
    }

    /**
     * Resolves the entries up front so a caller without completed jobs gets a 404 before any
     * byte of the archive is written.
     *
     * @return entry name to video file, in job listing order.
     */
    public Map<String, Path> entriesFor(Requester requester) {
        List<Job> completed = accessService.listForOwner(requester).stream()
                .filter(j -> j.getStatus() == JobStatus.COMPLETED)
                .toList();
        Map<String, Path> entries = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Job job : completed) {
            Optional<Path> video = storage.locateOutput(job.getId());
            if (video.isEmpty()) {
                LOGGER.warn("ARCHIVE skipping jobId={} (video missing)", job.getId());
                continue;
            }
            entries.put(uniqueName(ReplayFiles.stem(job.getOriginalFilename()), used), video.get());
        }
        if (entries.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "NO_COMPLETED_JOBS");
        }
        return entries;
    }

    /**
     * Videos purged after {@link #entriesFor} resolved them are left out of the archive.
     */
    public void writeArchive(Map<String, Path> entries, OutputStream out) throws IOException {
        int written = 0;
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, Path> e : entries.entrySet()) {
                InputStream video;
                try {
                    video = Files.newInputStream(e.getValue());
                } catch (NoSuchFileException missing) {
                    LOGGER.warn("ARCHIVE skipping entry={} (video removed) path={}", e.getKey(), e.getValue());
                    continue;
                }
                try (video) {
                    zip.putNextEntry(new ZipEntry(e.getKey()));
                    video.transferTo(zip);
                    zip.closeEntry();
                }
                written++;
            }
        }
        LOGGER.info("ARCHIVE written entries={} skipped={}", written, entries.size() - written);
    }

    static String uniqueName(String stem, Set<String> used) {
        String name = stem + ReplayFiles.VIDEO_EXTENSION;
        for (int n = 1; !used.add(name); n++) {
            name = stem + " (" + n + ")" + ReplayFiles.VIDEO_EXTENSION;
        }
        return name;
    }
}
