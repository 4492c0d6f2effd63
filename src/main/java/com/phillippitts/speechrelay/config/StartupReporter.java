package com.phillippitts.speechrelay.config;

import com.phillippitts.speechrelay.config.properties.RelayProperties;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Logs a one-time summary once the server is accepting connections.
 */
@Component
class StartupReporter {

    private static final Logger LOG = LogManager.getLogger(StartupReporter.class);

    private final Environment environment;
    private final RelayProperties relay;
    private final RecognitionGateway gateway;

    StartupReporter(Environment environment, RelayProperties relay, RecognitionGateway gateway) {
        this.environment = environment;
        this.relay = relay;
        this.gateway = gateway;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onReady() {
        LOG.info("Server is running on port {} (endpoint {}, allowed origin {})",
                environment.getProperty("local.server.port", environment.getProperty("server.port", "8080")),
                relay.getEndpoint(), relay.getAllowedOrigin());
        LOG.info("Active profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOG.info("Google credentials available: {}", gateway.isAvailable());
    }
}
