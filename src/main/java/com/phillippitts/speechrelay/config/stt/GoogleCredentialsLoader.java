package com.phillippitts.speechrelay.config.stt;

import com.google.auth.oauth2.GoogleCredentials;
import com.phillippitts.speechrelay.exception.RecognitionUnavailableException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Parses inline service account JSON into {@link GoogleCredentials}.
 */
final class GoogleCredentialsLoader {

    static final String NOT_CONFIGURED = "credentials not configured";

    private GoogleCredentialsLoader() {
    }

    /**
     * @param json service account JSON document
     * @return parsed credentials
     * @throws RecognitionUnavailableException if the payload is blank or cannot be parsed;
     *         the reason never contains key material
     */
    static GoogleCredentials load(String json) {
        if (json == null || json.isBlank()) {
            throw new RecognitionUnavailableException(NOT_CONFIGURED);
        }
        try (ByteArrayInputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return GoogleCredentials.fromStream(in);
        } catch (IOException | RuntimeException e) {
            throw new RecognitionUnavailableException("credentials could not be parsed (" + e.getClass().getSimpleName() + ")");
        }
    }
}
