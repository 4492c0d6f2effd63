package com.phillippitts.speechrelay.exception;

/**
 * Reported by a recognition stream when audio arrives after the stream has been
 * half-closed or has already finished. The message is always {@value #WRITE_AFTER_END}.
 */
public class StreamClosedException extends SpeechRelayException {

    public static final String WRITE_AFTER_END = "write after end";

    public StreamClosedException() {
        super(WRITE_AFTER_END);
    }

    /**
     * @return {@code true} if the error is the write-after-end race between a client
     *         write and a stream that has just finished
     */
    public static boolean isWriteAfterEnd(Throwable error) {
        return error != null && WRITE_AFTER_END.equals(error.getMessage());
    }
}
