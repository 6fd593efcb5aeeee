package com.example.minimap_backend.dto;

public record WebhookPresetResponse(String name, String url) {
}
