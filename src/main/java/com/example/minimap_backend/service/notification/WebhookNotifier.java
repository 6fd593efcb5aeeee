package com.example.minimap_backend.service.notification;

import com.example.minimap_backend.config.NotificationProperties;
import com.example.minimap_backend.exception.NotificationFailureException;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.util.ReplayFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts a render summary and the rendered video to a Discord-compatible webhook. Delivery is
 * attempted once; the outcome is logged and never affects the job.
 */
@Service
public class WebhookNotifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final Duration MIN_BLOCK_TIMEOUT = Duration.ofSeconds(5);

    private final WebClient webClient;
    private final RenderSummaryFormatter formatter;
    private final ObjectMapper objectMapper;
    private final TaskExecutor executor;
    private final Duration timeout;

    public WebhookNotifier(@Qualifier("webhookWebClient") WebClient webClient,
                           RenderSummaryFormatter formatter,
                           ObjectMapper objectMapper,
                           @Qualifier("notificationTaskExecutor") TaskExecutor executor,
                           NotificationProperties properties) {
        this.webClient = webClient;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
        this.executor = executor;
        Duration configured = properties.getTimeout() == null ? Duration.ofSeconds(60) : properties.getTimeout();
        this.timeout = configured.compareTo(MIN_BLOCK_TIMEOUT) < 0 ? MIN_BLOCK_TIMEOUT : configured;
    }

    public CompletableFuture<Boolean> dispatchAsync(String webhookUrl, Job job, Path metadataPath) {
        return CompletableFuture.supplyAsync(() -> notify(webhookUrl, job, metadataPath), executor);
    }

    /**
     * @return {@code true} when the target answered 200 or 204.
     */
    public boolean notify(String webhookUrl, Job job, Path metadataPath) {
        try {
            send(webhookUrl, job, metadataPath);
            LOGGER.info("WEBHOOK SENT jobId={}", job.getId());
            return true;
        } catch (NotificationFailureException e) {
            LOGGER.warn("WEBHOOK FAILED jobId={} reason={}", job.getId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            LOGGER.warn("WEBHOOK FAILED jobId={} type={} message={}", job.getId(), e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    private void send(String webhookUrl, Job job, Path metadataPath) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new NotificationFailureException("no webhook url");
        }
        Path video = job.getOutputPath() == null ? null : Path.of(job.getOutputPath());
        if (video == null || !Files.isRegularFile(video)) {
            throw new NotificationFailureException("video missing: " + video);
        }

        Map<String, Object> payload = formatter.fromMetadata(metadataPath);
        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part("payload_json", toJson(payload), MediaType.APPLICATION_JSON);
        form.part("file", new FileSystemResource(video), MediaType.parseMediaType("video/mp4"))
                .filename(ReplayFiles.videoName(job.getOriginalFilename()));

        HttpStatusCode status = webClient.post()
                .uri(webhookUrl)
                .body(BodyInserters.fromMultipartData(form.build()))
                .exchangeToMono(resp -> resp.releaseBody().thenReturn(resp.statusCode()))
                .block(timeout);

        if (status == null) {
            throw new NotificationFailureException("empty response");
        }
        if (status.value() != 200 && status.value() != 204) {
            throw new NotificationFailureException("webhook answered " + status.value());
        }
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new NotificationFailureException("payload serialization failed", e);
        }
    }
}
