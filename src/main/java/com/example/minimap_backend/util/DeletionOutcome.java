package com.example.minimap_backend.util;

/**
 * Result of a delete request. {@code DEFERRED} means the job was still processing and will be
 * purged by its worker once it reaches a terminal state.
 */
public enum DeletionOutcome {
    DELETED,
    DEFERRED
}
