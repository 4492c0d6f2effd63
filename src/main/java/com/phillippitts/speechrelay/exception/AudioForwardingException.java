package com.phillippitts.speechrelay.exception;

/**
 * Thrown when an audio chunk cannot be handed to the upstream recognition stream.
 */
public class AudioForwardingException extends SpeechRelayException {

    private final int chunkSize;

    public AudioForwardingException(int chunkSize, Throwable cause) {
        super("Failed to forward audio chunk (" + chunkSize + " bytes)", cause);
        this.chunkSize = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }
}
