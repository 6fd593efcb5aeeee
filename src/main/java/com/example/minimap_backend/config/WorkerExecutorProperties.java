package com.example.minimap_backend.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configures the render worker pool and the executor used for webhook notifications.
 */
@Validated
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    @Min(1)
    private int poolSize = 2;

    @Min(1)
    private int notificationThreads = 2;

    private int notificationQueueCapacity = 100;

    private boolean autoStart = true;

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getNotificationThreads() {
        return notificationThreads;
    }

    public void setNotificationThreads(int notificationThreads) {
        this.notificationThreads = notificationThreads;
    }

    public int getNotificationQueueCapacity() {
        return notificationQueueCapacity;
    }

    public void setNotificationQueueCapacity(int notificationQueueCapacity) {
        this.notificationQueueCapacity = notificationQueueCapacity;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
