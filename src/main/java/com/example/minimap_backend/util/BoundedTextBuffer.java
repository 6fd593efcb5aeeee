package com.example.minimap_backend.util;

/**
 * Thread-safe text sink that keeps only the last {@code limit} characters written to it.
 */
public class BoundedTextBuffer {
    static final String TRUNCATION_MARKER = "[truncated] ";

    private final int limit;
    private final StringBuilder buffer = new StringBuilder();
    private long dropped;

    public BoundedTextBuffer(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.limit = limit;
    }

    public synchronized void appendLine(String line) {
        buffer.append(line).append('\n');
        int overflow = buffer.length() - limit;
        if (overflow > 0) {
            buffer.delete(0, overflow);
            dropped += overflow;
        }
    }

    public synchronized boolean isTruncated() {
        return dropped > 0;
    }

    public synchronized boolean isBlank() {
        return buffer.toString().isBlank();
    }

    @Override
    public synchronized String toString() {
        String text = buffer.toString().strip();
        return dropped > 0 ? TRUNCATION_MARKER + text : text;
    }
}
