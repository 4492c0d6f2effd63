package com.phillippitts.speechrelay.service.stt;

import com.phillippitts.speechrelay.exception.RecognitionUnavailableException;
import com.phillippitts.speechrelay.testutil.TestRecognitionProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class UnavailableRecognitionGatewayTest {

    private final UnavailableRecognitionGateway gateway = new UnavailableRecognitionGateway("credentials not configured");

    @Test
    void refusesToOpenStreams() {
        RecognitionListener listener = mock(RecognitionListener.class);

        assertThatThrownBy(() -> gateway.open(TestRecognitionProperties.defaults(), listener))
                .isInstanceOf(RecognitionUnavailableException.class)
                .hasMessageContaining("credentials not configured");
        verifyNoInteractions(listener);
    }

    @Test
    void reportsUnavailableWithReason() {
        assertThat(gateway.isAvailable()).isFalse();
        assertThat(gateway.unavailableReason()).contains("credentials not configured");
        assertThatCode(gateway::close).doesNotThrowAnyException();
    }
}
