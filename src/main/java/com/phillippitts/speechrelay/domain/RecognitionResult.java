package com.phillippitts.speechrelay.domain;

import java.util.List;
import java.util.Optional;

/**
 * A single streaming recognition result. Interim results may be revised by later
 * results; final results will not change.
 *
 * @param alternatives candidate transcripts, most likely first
 * @param isFinal whether the backend considers this result final
 * @param stability estimate of how likely an interim result is to change (0.0 when unknown)
 */
public record RecognitionResult(List<RecognitionAlternative> alternatives, boolean isFinal, float stability) {

    public RecognitionResult {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public Optional<RecognitionAlternative> topAlternative() {
        return alternatives.isEmpty() ? Optional.empty() : Optional.of(alternatives.get(0));
    }
}
