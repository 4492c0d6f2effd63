package com.phillippitts.speechrelay.domain;

import java.util.List;
import java.util.Optional;

/**
 * One message emitted by an upstream recognition stream.
 *
 * @param results results in the order the backend reported them
 */
public record RecognitionResponse(List<RecognitionResult> results) {

    public RecognitionResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static RecognitionResponse of(RecognitionResult... results) {
        return new RecognitionResponse(List.of(results));
    }

    /**
     * Returns the first result's first alternative, if it carries any text.
     */
    public Optional<String> firstTranscript() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return results.get(0).topAlternative()
                .map(RecognitionAlternative::transcript)
                .filter(text -> !text.isEmpty());
    }
}
