package com.example.minimap_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Shared secret for the admin API. When blank the admin endpoints reject every request.
 */
@ConfigurationProperties(prefix = "admin")
public class AdminProperties {
    private String token = "";

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public boolean isEnabled() {
        return token != null && !token.isBlank();
    }
}
