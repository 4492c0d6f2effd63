package com.phillippitts.speechrelay.exception;

/**
 * Thrown when the speech recognition backend cannot be used because its credentials
 * are missing or could not be parsed at startup.
 */
public class RecognitionUnavailableException extends SpeechRelayException {

    private final String reason;

    public RecognitionUnavailableException(String reason) {
        super("Speech recognition unavailable: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
