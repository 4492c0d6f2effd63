package com.phillippitts.speechrelay.config.stt;

import com.google.auth.oauth2.GoogleCredentials;
import com.phillippitts.speechrelay.config.properties.SpeechCredentialsProperties;
import com.phillippitts.speechrelay.exception.RecognitionUnavailableException;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import com.phillippitts.speechrelay.service.stt.UnavailableRecognitionGateway;
import com.phillippitts.speechrelay.service.stt.google.GoogleRecognitionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Creates the single, shared {@link RecognitionGateway}.
 *
 * <p>Credential problems do not abort startup: the relay still serves connections and the
 * status endpoints, and every startStream request is answered with a "not configured" error.
 */
@Configuration
public class SpeechClientConfig {

    private static final Logger LOG = LogManager.getLogger(SpeechClientConfig.class);

    @Bean(destroyMethod = "close")
    public RecognitionGateway recognitionGateway(SpeechCredentialsProperties credentials) {
        GoogleCredentials googleCredentials;
        try {
            googleCredentials = GoogleCredentialsLoader.load(credentials.json());
        } catch (RecognitionUnavailableException e) {
            LOG.error("Speech-to-Text disabled: {}. Set GOOGLE_APPLICATION_CREDENTIALS to the service account JSON.",
                    e.getReason());
            return new UnavailableRecognitionGateway(e.getReason());
        }

        try {
            RecognitionGateway gateway = GoogleRecognitionGateway.create(googleCredentials);
            LOG.info("Speech-to-Text client initialized");
            return gateway;
        } catch (IOException | RuntimeException e) {
            LOG.error("Speech-to-Text disabled: client could not be created", e);
            return new UnavailableRecognitionGateway("client initialization failed");
        }
    }
}
