package com.clapgrow.channels.whatsapp.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/**
 * CORS for the channel API so browser dashboards can call it directly.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${cors.allowed-methods:GET,POST,PUT,DELETE,PATCH,OPTIONS}")
    private String[] allowedMethods;

    @Value("${cors.allowed-headers:*}")
    private String[] allowedHeaders;

    @Value("${cors.max-age:3600}")
    private long maxAge;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        boolean hasWildcard = Arrays.stream(allowedOrigins)
                .anyMatch(origin -> "*".equals(origin.trim()));

        configure(registry.addMapping("/v1/**"), hasWildcard);
        configure(registry.addMapping("/health"), hasWildcard);
    }

    private void configure(CorsRegistration registration, boolean hasWildcard) {
        registration.allowedMethods(allowedMethods)
                .allowedHeaders(allowedHeaders)
                .allowCredentials(true)
                .maxAge(maxAge);

        // "*" cannot be combined with credentials as a plain origin
        if (hasWildcard) {
            registration.allowedOriginPatterns("*");
        } else {
            registration.allowedOrigins(allowedOrigins);
        }
    }
}
