package com.phillippitts.speechrelay.service.stt;

import com.phillippitts.speechrelay.exception.AudioForwardingException;

/**
 * Client side of one open recognition stream.
 *
 * <p>Callers must invoke {@link #write} and {@link #end} from one thread at a time.
 * Writes that race with a stream that has already finished are reported to the
 * stream's {@link RecognitionListener#onError} as a
 * {@link com.phillippitts.speechrelay.exception.StreamClosedException}, not thrown.
 */
public interface RecognitionStream {

    /**
     * Sends one audio chunk upstream, unchanged.
     *
     * @param audio raw audio bytes in the configured encoding
     * @throws AudioForwardingException if the transport rejects the chunk
     */
    void write(byte[] audio);

    /**
     * Requests graceful closure. The backend may still deliver final results before
     * {@link RecognitionListener#onEnd()}. Calling more than once has no further effect.
     */
    void end();
}
