package com.phillippitts.speechrelay.domain;

/**
 * One candidate transcript for a recognized span of audio.
 *
 * @param transcript recognized text, never null (may be empty)
 * @param confidence backend confidence in [0.0, 1.0]; 0.0 when the backend does not report it
 */
public record RecognitionAlternative(String transcript, float confidence) {

    public RecognitionAlternative {
        if (transcript == null) {
            transcript = "";
        }
    }
}
