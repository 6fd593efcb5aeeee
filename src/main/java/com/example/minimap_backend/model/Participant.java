package com.example.minimap_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One player entry of the metadata artifact the renderer writes next to the video.
 * {@code relation} is the renderer's team category (0 ally, 1 enemy, 2 the recording player);
 * an entry without one is treated as the recording player.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Participant(
        String name,
        String clan,
        String ship,
        Integer relation,
        @JsonProperty("build_url") String buildUrl
) {
}
