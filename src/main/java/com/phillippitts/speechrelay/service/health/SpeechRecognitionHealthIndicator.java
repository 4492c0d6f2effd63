package com.phillippitts.speechrelay.service.health;

import com.phillippitts.speechrelay.service.session.SessionRegistry;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech recognition backend.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: credentials loaded, streams can be opened</li>
 *   <li>DOWN: credentials missing or invalid; the relay still accepts connections</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as the {@code speechRecognition} component.
 */
@Component
public class SpeechRecognitionHealthIndicator implements HealthIndicator {

    private final RecognitionGateway gateway;
    private final SessionRegistry sessions;

    public SpeechRecognitionHealthIndicator(RecognitionGateway gateway, SessionRegistry sessions) {
        this.gateway = gateway;
        this.sessions = sessions;
    }

    @Override
    public Health health() {
        Health.Builder builder = gateway.isAvailable() ? Health.up() : Health.down();
        builder.withDetail("credentialsConfigured", gateway.isAvailable())
                .withDetail("activeSessions", sessions.activeCount());
        gateway.unavailableReason().ifPresent(reason -> builder.withDetail("reason", reason));
        return builder.build();
    }
}
