package com.example.minimap_backend.config;

import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.service.WorkQueue;
import com.example.minimap_backend.service.WorkerService;
import org.springframework.boot.actuate.health.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator workQueueHealth(WorkQueue workQueue, WorkerService workerService) {
        return () -> {
            var builder = workerService.isRunning() ? Health.up() : Health.outOfService();
            return builder
                    .withDetail("queued", workQueue.size())
                    .withDetail("workers", workerService.activeWorkers())
                    .build();
        };
    }

    @Bean
    public HealthIndicator artifactStorageHealth(ArtifactStorage storage) {
        return () -> {
            boolean uploads = Files.isDirectory(storage.rootUploads()) && Files.isWritable(storage.rootUploads());
            boolean outputs = Files.isDirectory(storage.rootOutputs()) && Files.isWritable(storage.rootOutputs());
            var builder = uploads && outputs ? Health.up() : Health.down();
            return builder
                    .withDetail("uploads", storage.rootUploads().toString())
                    .withDetail("outputs", storage.rootOutputs().toString())
                    .build();
        };
    }
}
