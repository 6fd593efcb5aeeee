package com.example.minimap_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rendering options captured when a job is submitted. Immutable; persisted as JSON on the job row.
 *
 * @param anon              anonymize player names
 * @param noChat            hide the chat overlay
 * @param noLogs            hide ribbons, damage and kill logs
 * @param teamTracers       color shell tracers by team
 * @param fps               output frame rate
 * @param quality           output quality, 0 to 10
 * @param discordWebhookUrl optional webhook notified when the render completes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderConfig(
        boolean anon,
        @JsonProperty("no_chat") boolean noChat,
        @JsonProperty("no_logs") boolean noLogs,
        @JsonProperty("team_tracers") boolean teamTracers,
        int fps,
        int quality,
        @JsonProperty("discord_webhook_url") String discordWebhookUrl
) {
    public static final int DEFAULT_FPS = 20;
    public static final int DEFAULT_QUALITY = 7;
    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 10;
    public static final int MIN_FPS = 1;
    public static final int MAX_FPS = 60;

    public RenderConfig {
        if (discordWebhookUrl != null && discordWebhookUrl.isBlank()) {
            discordWebhookUrl = null;
        }
    }

    public static RenderConfig defaults() {
        return new RenderConfig(false, false, false, false, DEFAULT_FPS, DEFAULT_QUALITY, null);
    }

    @JsonIgnore
    public boolean hasWebhook() {
        return discordWebhookUrl != null;
    }
}
