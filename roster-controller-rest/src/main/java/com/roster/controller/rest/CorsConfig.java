package com.roster.controller.rest;

import com.roster.service.core.config.RosterProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Dashboards are usually hosted elsewhere, so every route answers cross-origin requests. */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final RosterProperties properties;

    public CorsConfig(RosterProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(
                        properties.getGateway().getCorsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "HEAD", "PUT", "PATCH", "POST", "DELETE");
    }
}
