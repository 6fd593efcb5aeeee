package com.example.minimap_backend.service;

import com.example.minimap_backend.config.RetentionProperties;
import com.example.minimap_backend.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Periodically purges completed and failed jobs whose completion is older than {@code retention.max-age}.
 */
@Service
public class RetentionSweeper {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);

    private final JobService jobService;
    private final JobCleanupService cleanupService;
    private final RetentionProperties properties;

    public RetentionSweeper(JobService jobService, JobCleanupService cleanupService, RetentionProperties properties) {
        this.jobService = jobService;
        this.cleanupService = cleanupService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${retention.sweep-interval-ms:3600000}",
            initialDelayString = "${retention.initial-delay-ms:60000}")
    public void scheduledSweep() {
        if (!properties.isEnabled()) {
            LOGGER.debug("Retention sweep disabled");
            return;
        }
        sweep();
    }

    /**
     * @return number of jobs purged in this cycle.
     */
    public int sweep() {
        List<Job> expired = jobService.listTerminalOlderThan(properties.getMaxAge());
        if (expired.isEmpty()) {
            LOGGER.debug("Retention sweep: nothing older than {}", properties.getMaxAge());
            return 0;
        }
        int purged = 0;
        for (Job job : expired) {
            try {
                cleanupService.purge(job.getId());
                purged++;
            } catch (RuntimeException e) {
                LOGGER.warn("Retention purge failed jobId={} err={}", job.getId(), e.toString());
            }
        }
        LOGGER.info("Retention sweep purged={} candidates={} maxAge={}", purged, expired.size(), properties.getMaxAge());
        return purged;
    }
}
