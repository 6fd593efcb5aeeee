package com.example.minimap_backend.controller;

import com.example.minimap_backend.config.AdminProperties;
import com.example.minimap_backend.dto.DeleteAllResponse;
import com.example.minimap_backend.dto.DeleteResponse;
import com.example.minimap_backend.dto.JobResponse;
import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.dto.RetentionPolicyResponse;
import com.example.minimap_backend.service.JobAccessService;
import com.example.minimap_backend.util.DeletionOutcome;
import io.swagger.v3.oas.annotations.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.UUID;

/**
 * Unscoped job administration. Every request must carry {@code X-Admin-Token}.
 */
@RestController
@RequestMapping("/admin")
public class AdminJobsController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdminJobsController.class);
    static final String TOKEN_HEADER = "X-Admin-Token";

    private final JobAccessService accessService;
    private final AdminProperties adminProperties;

    public AdminJobsController(JobAccessService accessService, AdminProperties adminProperties) {
        this.accessService = accessService;
        this.adminProperties = adminProperties;
    }

    @Operation(summary = "All jobs of all sessions, newest first")
    @GetMapping("/jobs")
    public List<JobResponse> list(@RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        return accessService.listAll(admin(token)).stream().map(JobResponse::from).toList();
    }

    @GetMapping("/jobs/{id}")
    public JobResponse get(@RequestHeader(value = TOKEN_HEADER, required = false) String token, @PathVariable UUID id) {
        return JobResponse.from(accessService.getStatus(admin(token), id));
    }

    @GetMapping("/jobs/{id}/video")
    public ResponseEntity<Resource> video(@RequestHeader(value = TOKEN_HEADER, required = false) String token, @PathVariable UUID id) {
        return ResponseEntity.ok()
                .contentType(JobsController.VIDEO_MP4)
                .body(new FileSystemResource(accessService.fetchOutput(admin(token), id)));
    }

    @GetMapping(value = "/jobs/{id}/info", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Resource> info(@RequestHeader(value = TOKEN_HEADER, required = false) String token, @PathVariable UUID id) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(new FileSystemResource(accessService.fetchMetadata(admin(token), id)));
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<DeleteResponse> delete(@RequestHeader(value = TOKEN_HEADER, required = false) String token, @PathVariable UUID id) {
        DeletionOutcome outcome = accessService.deleteJob(admin(token), id);
        HttpStatus status = outcome == DeletionOutcome.DEFERRED ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(new DeleteResponse(id, outcome));
    }

    @DeleteMapping("/jobs")
    public DeleteAllResponse deleteAll(@RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        return accessService.deleteAll(admin(token));
    }

    @GetMapping("/retention")
    public RetentionPolicyResponse retention(@RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        admin(token);
        return accessService.getRetentionPolicy();
    }

    private Requester admin(String token) {
        if (!adminProperties.isEnabled()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ADMIN_DISABLED");
        }
        if (token == null || !MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8),
                adminProperties.getToken().getBytes(StandardCharsets.UTF_8))) {
            LOGGER.warn("Admin request rejected (bad token)");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "ADMIN_TOKEN_INVALID");
        }
        return Requester.administrator();
    }
}
