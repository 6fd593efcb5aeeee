package com.example.minimap_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables configuration properties that have no dedicated configuration class.
 */
@Configuration
@EnableConfigurationProperties({RetentionProperties.class, AdminProperties.class})
public class AppPropertiesConfig {
}
