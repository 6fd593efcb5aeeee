package com.example.minimap_backend.config;

import com.example.minimap_backend.web.SessionRequesterResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {
    private final SessionRequesterResolver requesterResolver;

    public WebMvcConfig(SessionRequesterResolver requesterResolver) {
        this.requesterResolver = requesterResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(requesterResolver);
    }
}
