package com.example.backendtemplate.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * MVC configuration: CORS for all endpoints.
 * <p>
 * Origin patterns are used instead of plain origins so that "*" can be
 * combined with credentials.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final CorsProperties corsProperties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        var origins = corsProperties.getAllowedOriginList();
        log.info("Configuring CORS for origins {}", origins);

        registry.addMapping("/**")
                .allowedOriginPatterns(origins.toArray(new String[0]))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Request-ID", "X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(corsProperties.getMaxAgeSeconds());
    }
}
