package com.phillippitts.speechrelay.service.session;

import com.phillippitts.speechrelay.config.properties.RecognitionProperties;
import com.phillippitts.speechrelay.config.properties.RelayProperties;
import com.phillippitts.speechrelay.service.metrics.RelayMetrics;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the {@link StreamingSession} of every connected client, keyed by connection id.
 *
 * <p>Sessions share only the read-only gateway, configuration and metrics. On shutdown
 * every live upstream stream is ended so the backend is not left with open calls.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, StreamingSession> sessions = new ConcurrentHashMap<>();
    private final RecognitionGateway gateway;
    private final RecognitionProperties recognition;
    private final RelayProperties relay;
    private final RelayMetrics metrics;

    public SessionRegistry(RecognitionGateway gateway,
                           RecognitionProperties recognition,
                           RelayProperties relay,
                           RelayMetrics metrics) {
        this.gateway = gateway;
        this.recognition = recognition;
        this.relay = relay;
        this.metrics = metrics;
        metrics.bindActiveSessions(sessions::size);
    }

    /**
     * Creates and registers the session for a newly accepted connection.
     *
     * @throws IllegalStateException if a session with the same connection id is already registered
     */
    public StreamingSession open(ClientChannel channel) {
        StreamingSession session = new StreamingSession(channel, gateway, recognition,
                relay.getSession().getRestartTimeout(), metrics);
        StreamingSession existing = sessions.putIfAbsent(channel.id(), session);
        if (existing != null) {
            throw new IllegalStateException("Connection already registered: " + channel.id());
        }
        metrics.sessionOpened();
        return session;
    }

    public Optional<StreamingSession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    /**
     * Removes the session and tears down its stream. Unknown ids are ignored.
     */
    public void close(String connectionId) {
        StreamingSession session = sessions.remove(connectionId);
        if (session == null) {
            return;
        }
        session.onDisconnect();
        metrics.sessionClosed();
    }

    public int activeCount() {
        return sessions.size();
    }

    @PreDestroy
    void shutdown() {
        if (!sessions.isEmpty()) {
            LOG.info("Ending {} active session(s) on shutdown", sessions.size());
        }
        sessions.keySet().forEach(this::close);
    }
}
