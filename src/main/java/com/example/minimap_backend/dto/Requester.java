package com.example.minimap_backend.dto;

/**
 * Identity of the caller of a job operation: an opaque session token, or the administrator.
 */
public record Requester(String ownerToken, boolean admin) {

    public static Requester owner(String ownerToken) {
        return new Requester(ownerToken, false);
    }

    public static Requester administrator() {
        return new Requester(null, true);
    }
}
