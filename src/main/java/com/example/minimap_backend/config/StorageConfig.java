package com.example.minimap_backend.config;

import com.example.minimap_backend.service.Interfaces.ArtifactStorage;
import com.example.minimap_backend.service.LocalArtifactStorage;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public ArtifactStorage artifactStorage(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var storage = new LocalArtifactStorage(base, properties.getUploadPrefix(), properties.getOutputPrefix());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Artifact storage wired: base={}, uploadPrefix={}, outputPrefix={}", base, properties.getUploadPrefix(), properties.getOutputPrefix());
        return storage;
    }
}
