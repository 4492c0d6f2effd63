package com.phillippitts.speechrelay.config.stt;

import com.phillippitts.speechrelay.config.properties.SpeechCredentialsProperties;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import com.phillippitts.speechrelay.service.stt.UnavailableRecognitionGateway;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpeechClientConfigTest {

    private final SpeechClientConfig config = new SpeechClientConfig();

    @Test
    void fallsBackToUnavailableGatewayWhenCredentialsMissing() {
        RecognitionGateway gateway = config.recognitionGateway(new SpeechCredentialsProperties(""));

        assertThat(gateway).isInstanceOf(UnavailableRecognitionGateway.class);
        assertThat(gateway.isAvailable()).isFalse();
        assertThat(gateway.unavailableReason()).contains("credentials not configured");
    }

    @Test
    void fallsBackToUnavailableGatewayWhenCredentialsInvalid() {
        RecognitionGateway gateway = config.recognitionGateway(new SpeechCredentialsProperties("{\"type\":\"bogus\"}"));

        assertThat(gateway.isAvailable()).isFalse();
        assertThat(gateway.unavailableReason()).hasValueSatisfying(
                reason -> assertThat(reason).startsWith("credentials could not be parsed"));
    }
}
