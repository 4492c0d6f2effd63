package com.phillippitts.speechrelay.exception;

/**
 * Thrown when the recognition backend rejects a stream configuration or fails
 * while the streaming call is being opened.
 */
public class StreamStartException extends SpeechRelayException {

    public StreamStartException(String message) {
        super(message);
    }

    public StreamStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
