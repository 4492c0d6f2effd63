package com.phillippitts.speechrelay.service.session;

/**
 * Outbound half of a client connection, as seen by a {@link StreamingSession}.
 *
 * <p>Implementations must be safe to call from any thread and must never throw: delivery
 * failures are logged and dropped, since the connection may already be going away.
 */
public interface ClientChannel {

    /**
     * @return opaque identifier of the connection, unique among active connections
     */
    String id();

    /**
     * Sends one recognized utterance or partial result.
     */
    void sendTranscription(String text);

    /**
     * Sends a short, human-readable error description.
     */
    void sendError(String message);
}
