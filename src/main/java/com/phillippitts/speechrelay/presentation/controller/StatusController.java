package com.phillippitts.speechrelay.presentation.controller;

import com.phillippitts.speechrelay.service.session.SessionRegistry;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoint for operational monitoring. Always 200 while the process is serving;
 * whether recognition works is reported in the body.
 */
@RestController
class StatusController {

    private static final Logger log = LogManager.getLogger(StatusController.class);

    private final RecognitionGateway gateway;
    private final SessionRegistry sessions;

    StatusController(RecognitionGateway gateway, SessionRegistry sessions) {
        this.gateway = gateway;
        this.sessions = sessions;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> status() {
        log.debug("Status requested");
        return ResponseEntity.ok(Map.of(
                "status", "Server is running",
                "credentialsConfigured", gateway.isAvailable(),
                "activeSessions", sessions.activeCount(),
                "timestamp", Instant.now().toString()
        ));
    }
}
