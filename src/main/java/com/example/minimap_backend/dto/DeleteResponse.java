package com.example.minimap_backend.dto;

import com.example.minimap_backend.util.DeletionOutcome;

import java.util.UUID;

public record DeleteResponse(UUID id, DeletionOutcome outcome) {
}
