package com.phillippitts.speechrelay.service.stt;

import com.phillippitts.speechrelay.config.properties.RecognitionProperties;
import com.phillippitts.speechrelay.exception.RecognitionUnavailableException;
import com.phillippitts.speechrelay.exception.StreamStartException;

import java.util.Optional;

/**
 * Entry point to an external streaming speech-recognition service.
 *
 * <p>A single gateway instance is created at startup and shared by every session.
 * Implementations must be thread-safe; only the streams they open are per-session.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link com.phillippitts.speechrelay.service.stt.google.GoogleRecognitionGateway} - Google
 *       Cloud Speech-to-Text bidirectional streaming</li>
 *   <li>{@link UnavailableRecognitionGateway} - installed when credentials are missing or invalid</li>
 * </ul>
 */
public interface RecognitionGateway extends AutoCloseable {

    /**
     * Opens a new bidirectional recognition stream.
     *
     * <p>Events for the stream are delivered to {@code listener} asynchronously, possibly on
     * a thread other than the caller's and possibly before this method returns.
     *
     * @param config recognition configuration sent as the first request on the stream
     * @param listener receiver of data, error and end events for this stream only
     * @return handle used to write audio and request closure
     * @throws RecognitionUnavailableException if the backend is not configured
     * @throws StreamStartException if the backend rejects the configuration or the call fails to open
     */
    RecognitionStream open(RecognitionProperties config, RecognitionListener listener);

    /**
     * @return {@code true} if credentials were loaded and streams can be opened
     */
    boolean isAvailable();

    /**
     * @return human-readable reason when {@link #isAvailable()} is {@code false}
     */
    default Optional<String> unavailableReason() {
        return Optional.empty();
    }

    /**
     * Releases the underlying client. Streams opened earlier are not guaranteed to survive.
     */
    @Override
    void close();
}
