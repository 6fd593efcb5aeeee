package com.example.minimap_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Age after which finished jobs are purged, also expressed in whole hours for display.
 */
public record RetentionPolicyResponse(
        boolean enabled,
        @JsonProperty("max_age") Duration maxAge,
        @JsonProperty("cleanup_hours") long cleanupHours
) {
    public static RetentionPolicyResponse of(boolean enabled, Duration maxAge) {
        return new RetentionPolicyResponse(enabled, maxAge, maxAge.toHours());
    }
}
