package com.phillippitts.speechrelay.exception;

/**
 * Base exception for all speech-relay application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeechRelayException extends RuntimeException {

    public SpeechRelayException(String message) {
        super(message);
    }

    public SpeechRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeechRelayException(Throwable cause) {
        super(cause);
    }
}
