package com.phillippitts.speechrelay.presentation.websocket;

import com.phillippitts.speechrelay.config.properties.RelayProperties;
import com.phillippitts.speechrelay.service.session.SessionRegistry;
import com.phillippitts.speechrelay.service.session.StreamingSession;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator.OverflowStrategy;

import java.nio.ByteBuffer;
import java.util.function.Consumer;

/**
 * WebSocket endpoint for the relay.
 *
 * <p>Maps transport events onto the connection's {@link StreamingSession}:
 * <ul>
 *   <li>connection opened - session created</li>
 *   <li>text frame {@code startStream} / {@code endStream} - {@code onStart} / {@code onStop}</li>
 *   <li>binary frame - {@code onAudioChunk}</li>
 *   <li>connection closed - {@code onDisconnect} and session removed</li>
 * </ul>
 *
 * <p>No failure escapes a callback: errors are logged under the connection id and the
 * connection is left open for the client to decide what to do.
 */
@Component
public class SpeechRelayWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(SpeechRelayWebSocketHandler.class);

    static final String CONNECTION_ID = "connectionId";

    private final SessionRegistry sessions;
    private final RelayMessageCodec codec;
    private final RelayProperties.WebSocketProperties limits;

    public SpeechRelayWebSocketHandler(SessionRegistry sessions, RelayMessageCodec codec, RelayProperties relay) {
        this.sessions = sessions;
        this.codec = codec;
        this.limits = relay.getWebsocket();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(CONNECTION_ID, session.getId())) {
            // DROP: a full buffer discards the oldest frames; only a stuck send closes the connection
            WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session,
                    (int) limits.getSendTimeLimit().toMillis(), limits.getSendBufferSizeLimit(), OverflowStrategy.DROP);
            sessions.open(new WebSocketClientChannel(concurrent, codec));
            LOG.info("Client connected: remote={}", session.getRemoteAddress());
        } catch (RuntimeException e) {
            LOG.error("Failed to register connection", e);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        withSession(session, streaming -> codec.decode(message.getPayload()).ifPresentOrElse(
                event -> {
                    switch (event) {
                        case START_STREAM -> streaming.onStart();
                        case END_STREAM -> streaming.onStop();
                    }
                },
                () -> LOG.warn("Ignoring unrecognized control message ({} chars)", message.getPayloadLength())));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        withSession(session, streaming -> streaming.onAudioChunk(toBytes(message.getPayload())));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(CONNECTION_ID, session.getId())) {
            LOG.warn("Transport error: {}", exception.toString());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(CONNECTION_ID, session.getId())) {
            LOG.info("Client disconnected: code={}", status.getCode());
            sessions.close(session.getId());
        } catch (RuntimeException e) {
            LOG.error("Error tearing down session", e);
        }
    }

    private void withSession(WebSocketSession session, Consumer<StreamingSession> action) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(CONNECTION_ID, session.getId())) {
            StreamingSession streaming = sessions.find(session.getId()).orElse(null);
            if (streaming == null) {
                LOG.warn("Message received for unknown connection");
                return;
            }
            try {
                action.accept(streaming);
            } catch (RuntimeException e) {
                LOG.error("Unhandled error while processing client message", e);
            }
        }
    }

    private static byte[] toBytes(ByteBuffer payload) {
        ByteBuffer view = payload.asReadOnlyBuffer();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }
}
