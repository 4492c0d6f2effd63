package com.phillippitts.speechrelay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Transport-level configuration for the relay: handshake origin, endpoint path,
 * per-session timing and WebSocket buffer limits.
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private String allowedOrigin = "http://localhost:3000";
    private String endpoint = "/ws/speech";
    private SessionProperties session = new SessionProperties();
    private WebSocketProperties websocket = new WebSocketProperties();

    public String getAllowedOrigin() {
        return allowedOrigin;
    }

    public void setAllowedOrigin(String allowedOrigin) {
        this.allowedOrigin = allowedOrigin;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public SessionProperties getSession() {
        return session;
    }

    public void setSession(SessionProperties session) {
        this.session = session;
    }

    public WebSocketProperties getWebsocket() {
        return websocket;
    }

    public void setWebsocket(WebSocketProperties websocket) {
        this.websocket = websocket;
    }

    /**
     * Streaming session behaviour.
     */
    public static class SessionProperties {
        /** How long a repeated startStream waits for the previous stream to confirm closure. */
        private Duration restartTimeout = Duration.ofSeconds(2);

        public Duration getRestartTimeout() {
            return restartTimeout;
        }

        public void setRestartTimeout(Duration restartTimeout) {
            this.restartTimeout = restartTimeout;
        }
    }

    /**
     * WebSocket container and outbound send limits.
     */
    public static class WebSocketProperties {
        private int maxBinaryMessageBytes = 1024 * 1024;
        private int maxTextMessageBytes = 64 * 1024;
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int sendBufferSizeLimit = 512 * 1024;

        public int getMaxBinaryMessageBytes() {
            return maxBinaryMessageBytes;
        }

        public void setMaxBinaryMessageBytes(int maxBinaryMessageBytes) {
            this.maxBinaryMessageBytes = maxBinaryMessageBytes;
        }

        public int getMaxTextMessageBytes() {
            return maxTextMessageBytes;
        }

        public void setMaxTextMessageBytes(int maxTextMessageBytes) {
            this.maxTextMessageBytes = maxTextMessageBytes;
        }

        public Duration getSendTimeLimit() {
            return sendTimeLimit;
        }

        public void setSendTimeLimit(Duration sendTimeLimit) {
            this.sendTimeLimit = sendTimeLimit;
        }

        public int getSendBufferSizeLimit() {
            return sendBufferSizeLimit;
        }

        public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
            this.sendBufferSizeLimit = sendBufferSizeLimit;
        }
    }
}
