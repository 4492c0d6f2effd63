package com.phillippitts.speechrelay.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Fixed configuration sent with every streaming recognition request.
 * Binds to properties prefixed with "speech.recognition".
 *
 * <p>Example application.properties:
 * <pre>
 * speech.recognition.encoding=WEBM_OPUS
 * speech.recognition.sample-rate-hertz=48000
 * speech.recognition.language-code=en-US
 * speech.recognition.enable-automatic-punctuation=true
 * speech.recognition.model=latest_short
 * speech.recognition.interim-results=true
 * </pre>
 *
 * @param encoding audio encoding name as understood by the backend (e.g. WEBM_OPUS, LINEAR16)
 * @param sampleRateHertz sample rate of the client's audio in Hz
 * @param languageCode BCP-47 language tag
 * @param enableAutomaticPunctuation whether the backend should insert punctuation
 * @param model recognition model variant
 * @param interimResults whether partial (non-final) results are streamed back
 */
@ConfigurationProperties(prefix = "speech.recognition")
@Validated
public record RecognitionProperties(
        @NotBlank(message = "Recognition encoding must not be blank")
        @DefaultValue("WEBM_OPUS")
        String encoding,

        @Positive(message = "Sample rate must be positive")
        @DefaultValue("48000")
        int sampleRateHertz,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("en-US")
        String languageCode,

        @DefaultValue("true")
        boolean enableAutomaticPunctuation,

        @NotBlank(message = "Recognition model must not be blank")
        @DefaultValue("latest_short")
        String model,

        @DefaultValue("true")
        boolean interimResults
) {
}
