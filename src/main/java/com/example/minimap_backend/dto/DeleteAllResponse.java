package com.example.minimap_backend.dto;

public record DeleteAllResponse(int deleted, int deferred) {
}
