package com.phillippitts.speechrelay.service.stt;

import com.phillippitts.speechrelay.config.properties.RecognitionProperties;
import com.phillippitts.speechrelay.exception.RecognitionUnavailableException;

import java.util.Objects;
import java.util.Optional;

/**
 * Gateway installed when the backend could not be configured at startup.
 * The service keeps running; every attempt to open a stream is refused.
 */
public final class UnavailableRecognitionGateway implements RecognitionGateway {

    private final String reason;

    public UnavailableRecognitionGateway(String reason) {
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    @Override
    public RecognitionStream open(RecognitionProperties config, RecognitionListener listener) {
        throw new RecognitionUnavailableException(reason);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public Optional<String> unavailableReason() {
        return Optional.of(reason);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
