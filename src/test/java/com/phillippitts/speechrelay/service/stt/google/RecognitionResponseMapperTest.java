package com.phillippitts.speechrelay.service.stt.google;

import com.google.cloud.speech.v1.SpeechRecognitionAlternative;
import com.google.cloud.speech.v1.StreamingRecognitionResult;
import com.google.cloud.speech.v1.StreamingRecognizeResponse;
import com.phillippitts.speechrelay.domain.RecognitionAlternative;
import com.phillippitts.speechrelay.domain.RecognitionResponse;
import com.phillippitts.speechrelay.domain.RecognitionResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecognitionResponseMapperTest {

    @Test
    void mapsResultsAndAlternativesInOrder() {
        StreamingRecognizeResponse response = StreamingRecognizeResponse.newBuilder()
                .addResults(StreamingRecognitionResult.newBuilder()
                        .addAlternatives(SpeechRecognitionAlternative.newBuilder()
                                .setTranscript("turn left").setConfidence(0.92f))
                        .addAlternatives(SpeechRecognitionAlternative.newBuilder()
                                .setTranscript("turn lift").setConfidence(0.4f))
                        .setIsFinal(true))
                .addResults(StreamingRecognitionResult.newBuilder()
                        .addAlternatives(SpeechRecognitionAlternative.newBuilder().setTranscript(" now"))
                        .setStability(0.3f))
                .build();

        RecognitionResponse mapped = RecognitionResponseMapper.toResponse(response);

        assertThat(mapped.results()).hasSize(2);
        RecognitionResult first = mapped.results().get(0);
        assertThat(first.isFinal()).isTrue();
        assertThat(first.alternatives()).extracting(RecognitionAlternative::transcript).containsExactly("turn left", "turn lift");
        assertThat(first.alternatives().get(0).confidence()).isEqualTo(0.92f);
        RecognitionResult second = mapped.results().get(1);
        assertThat(second.isFinal()).isFalse();
        assertThat(second.stability()).isEqualTo(0.3f);
        assertThat(mapped.firstTranscript()).contains("turn left");
    }

    @Test
    void mapsEmptyResponse() {
        RecognitionResponse mapped = RecognitionResponseMapper.toResponse(StreamingRecognizeResponse.getDefaultInstance());

        assertThat(mapped.results()).isEmpty();
        assertThat(mapped.firstTranscript()).isEmpty();
    }
}
