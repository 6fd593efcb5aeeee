package com.example.minimap_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process FIFO hand-off of job ids from submission to the worker loops. Each enqueued id is
 * taken by exactly one worker.
 */
@Component
public class WorkQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkQueue.class);

    private final BlockingQueue<UUID> queue = new LinkedBlockingQueue<>();

    public void enqueue(UUID jobId) {
        Objects.requireNonNull(jobId, "jobId");
        queue.add(jobId);
        LOGGER.debug("Enqueued jobId={} depth={}", jobId, queue.size());
    }

    /** Blocks until a job id is available. */
    public UUID take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }
}
