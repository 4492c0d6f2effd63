package com.phillippitts.speechrelay.presentation.websocket;

import com.phillippitts.speechrelay.presentation.websocket.RelayMessageCodec.OutboundEvent;
import com.phillippitts.speechrelay.service.session.ClientChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}.
 *
 * <p>The session passed in must already be safe for concurrent sends (see
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}), because
 * transcriptions arrive on gateway threads while errors may be sent from the container thread.
 */
class WebSocketClientChannel implements ClientChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketClientChannel.class);

    private final WebSocketSession session;
    private final RelayMessageCodec codec;

    WebSocketClientChannel(WebSocketSession session, RelayMessageCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void sendTranscription(String text) {
        send(OutboundEvent.TRANSCRIPTION, text);
    }

    @Override
    public void sendError(String message) {
        send(OutboundEvent.ERROR, message);
    }

    private void send(OutboundEvent event, String data) {
        if (!session.isOpen()) {
            LOG.debug("Dropping '{}' event: connection {} already closed", event.wireName(), session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(event, data)));
        } catch (SessionLimitExceededException e) {
            // the decorator refuses every later send, so the client must reconnect
            LOG.warn("Closing connection {}: client not keeping up ({})", session.getId(), e.getMessage());
            close(e.getStatus());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to send '{}' event to connection {}: {}", event.wireName(), session.getId(), e.toString());
        }
    }

    private void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to close connection {}: {}", session.getId(), e.toString());
        }
    }
}
