package com.phillippitts.speechrelay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Google Cloud service account credentials, supplied inline as a JSON document.
 * Binds to {@code speech.credentials.json}, which defaults to the
 * {@code GOOGLE_APPLICATION_CREDENTIALS} environment variable.
 *
 * @param json service account JSON payload; may be null or blank when not configured
 */
@ConfigurationProperties(prefix = "speech.credentials")
public record SpeechCredentialsProperties(String json) {

    public boolean isPresent() {
        return json != null && !json.isBlank();
    }

    @Override
    public String toString() {
        // never print the key material
        return "SpeechCredentialsProperties[present=" + isPresent() + "]";
    }
}
