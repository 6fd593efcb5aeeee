package com.example.minimap_backend.controller;

import com.example.minimap_backend.config.NotificationProperties;
import com.example.minimap_backend.dto.DeleteAllResponse;
import com.example.minimap_backend.dto.DeleteResponse;
import com.example.minimap_backend.dto.JobResponse;
import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.dto.RetentionPolicyResponse;
import com.example.minimap_backend.dto.UploadResponse;
import com.example.minimap_backend.dto.WebhookPresetResponse;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.service.ArchiveService;
import com.example.minimap_backend.service.JobAccessService;
import com.example.minimap_backend.service.UploadService;
import com.example.minimap_backend.util.DeletionOutcome;
import com.example.minimap_backend.util.ReplayFiles;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Session-scoped job API. The caller is identified by the {@code session_id} cookie.
 */
@RestController
@RequestMapping("/api")
public class JobsController {
    static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");
    private static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final UploadService uploadService;
    private final JobAccessService accessService;
    private final ArchiveService archiveService;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    public JobsController(UploadService uploadService, JobAccessService accessService, ArchiveService archiveService,
                          NotificationProperties notificationProperties, Clock clock) {
        this.uploadService = uploadService;
        this.accessService = accessService;
        this.archiveService = archiveService;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    @Operation(summary = "Upload a replay and queue it for rendering")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadResponse upload(Requester requester,
                                 @RequestParam("file") MultipartFile file,
                                 @RequestParam(value = "anon", defaultValue = "false") boolean anon,
                                 @RequestParam(value = "no_chat", defaultValue = "false") boolean noChat,
                                 @RequestParam(value = "no_logs", defaultValue = "false") boolean noLogs,
                                 @RequestParam(value = "team_tracers", defaultValue = "false") boolean teamTracers,
                                 @RequestParam(value = "fps", defaultValue = "20") int fps,
                                 @RequestParam(value = "quality", defaultValue = "7") int quality,
                                 @RequestParam(value = "discord_webhook_url", required = false) String discordWebhookUrl) {
        RenderConfig config = new RenderConfig(anon, noChat, noLogs, teamTracers, fps, quality, discordWebhookUrl);
        return UploadResponse.from(uploadService.submit(requester.ownerToken(), file, config));
    }

    @GetMapping("/jobs")
    public List<JobResponse> list(Requester requester) {
        return accessService.listForOwner(requester).stream().map(JobResponse::from).toList();
    }

    @GetMapping("/jobs/{id}")
    public JobResponse get(Requester requester, @PathVariable UUID id) {
        return JobResponse.from(accessService.getStatus(requester, id));
    }

    @Operation(summary = "Player list written by the renderer for a completed job")
    @GetMapping(value = "/jobs/{id}/info", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Resource> info(Requester requester, @PathVariable UUID id) {
        Path metadata = accessService.fetchMetadata(requester, id);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(new FileSystemResource(metadata));
    }

    @GetMapping("/stream/{id}")
    public ResponseEntity<Resource> stream(Requester requester, @PathVariable UUID id) {
        Path video = accessService.fetchOutput(requester, id);
        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.inline().build().toString())
                .body(new FileSystemResource(video));
    }

    @GetMapping("/download/{id}")
    public ResponseEntity<Resource> download(Requester requester, @PathVariable UUID id) {
        Job job = accessService.getStatus(requester, id);
        Path video = accessService.fetchOutput(requester, id);
        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(ReplayFiles.videoName(job.getOriginalFilename())))
                .body(new FileSystemResource(video));
    }

    @Operation(summary = "ZIP of every completed video of this session")
    @GetMapping("/download-all")
    public ResponseEntity<StreamingResponseBody> downloadAll(Requester requester) {
        Map<String, Path> entries = archiveService.entriesFor(requester);
        String filename = "minimap_renders_" + LocalDateTime.now(clock).format(ARCHIVE_STAMP) + ".zip";
        StreamingResponseBody body = out -> archiveService.writeArchive(entries, out);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(filename))
                .body(body);
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<DeleteResponse> delete(Requester requester, @PathVariable UUID id) {
        DeletionOutcome outcome = accessService.deleteJob(requester, id);
        HttpStatus status = outcome == DeletionOutcome.DEFERRED ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(new DeleteResponse(id, outcome));
    }

    @DeleteMapping("/jobs")
    public DeleteAllResponse deleteAll(Requester requester) {
        return accessService.deleteAllForOwner(requester);
    }

    @GetMapping("/config/webhooks")
    public List<WebhookPresetResponse> webhookPresets() {
        return notificationProperties.getWebhooks().stream()
                .filter(p -> p.getUrl() != null && !p.getUrl().isBlank())
                .map(p -> new WebhookPresetResponse(p.getName(), p.getUrl()))
                .toList();
    }

    @GetMapping("/retention")
    public RetentionPolicyResponse retention() {
        return accessService.getRetentionPolicy();
    }

    private static String attachment(String filename) {
        return ContentDisposition.attachment().filename(filename, StandardCharsets.UTF_8).build().toString();
    }
}
