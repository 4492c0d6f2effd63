package com.phillippitts.speechrelay.config;

import com.phillippitts.speechrelay.config.properties.RelayProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Allows the browser client's origin to call the HTTP status endpoints.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final RelayProperties relay;

    public CorsConfig(RelayProperties relay) {
        this.relay = relay;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(relay.getAllowedOrigin())
                .allowedMethods("GET", "POST");
    }
}
