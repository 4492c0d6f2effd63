package com.phillippitts.speechrelay.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void speechRelayExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        SpeechRelayException ex = new SpeechRelayException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void recognitionUnavailableShouldExposeReason() {
        RecognitionUnavailableException ex = new RecognitionUnavailableException("credentials not configured");

        assertThat(ex.getReason()).isEqualTo("credentials not configured");
        assertThat(ex.getMessage()).isEqualTo("Speech recognition unavailable: credentials not configured");
    }

    @Test
    void audioForwardingShouldExposeChunkSize() {
        IllegalStateException cause = new IllegalStateException("call closed");
        AudioForwardingException ex = new AudioForwardingException(4096, cause);

        assertThat(ex.getChunkSize()).isEqualTo(4096);
        assertThat(ex.getMessage()).contains("4096 bytes");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void streamClosedShouldCarryWriteAfterEndMessage() {
        StreamClosedException ex = new StreamClosedException();

        assertThat(ex.getMessage()).isEqualTo("write after end");
        assertThat(StreamClosedException.isWriteAfterEnd(ex)).isTrue();
    }

    @Test
    void writeAfterEndIsRecognizedByMessageOnly() {
        assertThat(StreamClosedException.isWriteAfterEnd(new IllegalStateException("write after end"))).isTrue();
        assertThat(StreamClosedException.isWriteAfterEnd(new IllegalStateException("Write after end"))).isFalse();
        assertThat(StreamClosedException.isWriteAfterEnd(new IllegalStateException())).isFalse();
        assertThat(StreamClosedException.isWriteAfterEnd(null)).isFalse();
    }

    @Test
    void allExceptionsShouldExtendSpeechRelayException() {
        assertThat(new RecognitionUnavailableException("x")).isInstanceOf(SpeechRelayException.class);
        assertThat(new StreamStartException("x")).isInstanceOf(SpeechRelayException.class);
        assertThat(new AudioForwardingException(1, null)).isInstanceOf(SpeechRelayException.class);
        assertThat(new StreamClosedException()).isInstanceOf(SpeechRelayException.class);
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new SpeechRelayException("x")).isInstanceOf(RuntimeException.class);
    }
}
