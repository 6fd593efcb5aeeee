package com.example.minimap_backend.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Webhook notification settings.
 */
@Validated
@ConfigurationProperties(prefix = "notification")
public class NotificationProperties {

    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Relation categories that are never the subject of a render summary. Everyone else in the
     * metadata is listed as "Player In Render".
     */
    private Set<Integer> reservedRelations = new LinkedHashSet<>(List.of(0, 1));

    @Min(16)
    private int otherPlayersByteLimit = 1024;

    /** Named webhook targets offered to clients. */
    private List<WebhookPreset> webhooks = new ArrayList<>();

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Set<Integer> getReservedRelations() {
        return reservedRelations;
    }

    public void setReservedRelations(Set<Integer> reservedRelations) {
        this.reservedRelations = reservedRelations;
    }

    public int getOtherPlayersByteLimit() {
        return otherPlayersByteLimit;
    }

    public void setOtherPlayersByteLimit(int otherPlayersByteLimit) {
        this.otherPlayersByteLimit = otherPlayersByteLimit;
    }

    public List<WebhookPreset> getWebhooks() {
        return webhooks;
    }

    public void setWebhooks(List<WebhookPreset> webhooks) {
        this.webhooks = webhooks;
    }

    public static class WebhookPreset {
        private String name;
        private String url;

        public WebhookPreset() {
        }

        public WebhookPreset(String name, String url) {
            this.name = name;
            this.url = url;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
