package com.example.minimap_backend.config;

import com.example.minimap_backend.engine.Interfaces.Renderer;
import com.example.minimap_backend.engine.SubprocessRenderer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RendererProperties.class)
public class EngineConfig {

    @Bean
    public Renderer renderer(RendererProperties properties) {
        Duration timeout = properties.getTimeout() != null ? properties.getTimeout() : Duration.ofHours(2);
        return new SubprocessRenderer(
                properties.getCommand(),
                Path.of(properties.getWorkingDir()),
                timeout,
                properties.getDiagnosticsLimit()
        );
    }
}
