package com.example.minimap_backend.exception;

/**
 * Webhook delivery failed. Only ever logged; never changes a job's state.
 */
public class NotificationFailureException extends RuntimeException {
    public NotificationFailureException(String message) {
        super(message);
    }

    public NotificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
