package com.gastos.mcpgateway.config;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

/**
 * CORS policy for browser-based agents.
 * Allowed origins come from gw.cors-origins ("*" allows any origin).
 */
@Configuration
public class CorsConfig {
    private static final Logger log = LoggerFactory.getLogger(CorsConfig.class);

    @Bean
    public CorsWebFilter corsWebFilter(GwProperties properties) {
        List<String> origins = properties.corsOriginList();

        CorsConfiguration cors = new CorsConfiguration();
        // Credentials are allowed, so a wildcard must be expressed as a pattern
        if (origins.contains("*")) {
            cors.addAllowedOriginPattern("*");
        } else {
            cors.setAllowedOrigins(origins);
        }
        cors.setAllowCredentials(true);
        cors.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        cors.setAllowedHeaders(List.of("Content-Type", "Authorization", "X-API-Key"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cors);

        log.info("CORS configured for origins={}", origins);
        return new CorsWebFilter(source);
    }
}
