package com.example.minimap_backend.util;

public enum ArtifactRole {
    INPUT,
    OUTPUT_VIDEO,
    OUTPUT_METADATA
}
