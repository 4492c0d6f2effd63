package com.phillippitts.speechrelay.service.stt.google;

import com.google.cloud.speech.v1.SpeechRecognitionAlternative;
import com.google.cloud.speech.v1.StreamingRecognitionResult;
import com.google.cloud.speech.v1.StreamingRecognizeResponse;
import com.phillippitts.speechrelay.domain.RecognitionAlternative;
import com.phillippitts.speechrelay.domain.RecognitionResponse;
import com.phillippitts.speechrelay.domain.RecognitionResult;

import java.util.ArrayList;
import java.util.List;

/** Converts Speech-to-Text protobuf responses into the library-independent domain model. */
final class RecognitionResponseMapper {

    private RecognitionResponseMapper() {
    }

    static RecognitionResponse toResponse(StreamingRecognizeResponse response) {
        List<RecognitionResult> results = new ArrayList<>(response.getResultsCount());
        for (StreamingRecognitionResult result : response.getResultsList()) {
            results.add(toResult(result));
        }
        return new RecognitionResponse(results);
    }

    private static RecognitionResult toResult(StreamingRecognitionResult result) {
        List<RecognitionAlternative> alternatives = new ArrayList<>(result.getAlternativesCount());
        for (SpeechRecognitionAlternative alternative : result.getAlternativesList()) {
            alternatives.add(new RecognitionAlternative(alternative.getTranscript(), alternative.getConfidence()));
        }
        return new RecognitionResult(alternatives, result.getIsFinal(), result.getStability());
    }
}
