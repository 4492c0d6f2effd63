package com.phillippitts.speechrelay.service.stt.google;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.rpc.ClientStream;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.speech.v1.RecognitionConfig;
import com.google.cloud.speech.v1.SpeechClient;
import com.google.cloud.speech.v1.SpeechSettings;
import com.google.cloud.speech.v1.StreamingRecognitionConfig;
import com.google.cloud.speech.v1.StreamingRecognizeRequest;
import com.phillippitts.speechrelay.config.properties.RecognitionProperties;
import com.phillippitts.speechrelay.exception.StreamStartException;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import com.phillippitts.speechrelay.service.stt.RecognitionListener;
import com.phillippitts.speechrelay.service.stt.RecognitionStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link RecognitionGateway} backed by Google Cloud Speech-to-Text v1 bidirectional
 * streaming ({@code streamingRecognize}).
 *
 * <p>Wraps one long-lived {@link SpeechClient}. The client is thread-safe and is shared by all
 * sessions; each {@link #open} call starts an independent gRPC stream whose first request
 * carries the {@link StreamingRecognitionConfig}.
 */
public final class GoogleRecognitionGateway implements RecognitionGateway {

    private static final Logger LOG = LogManager.getLogger(GoogleRecognitionGateway.class);

    private final SpeechClient speechClient;

    public GoogleRecognitionGateway(SpeechClient speechClient) {
        this.speechClient = Objects.requireNonNull(speechClient, "speechClient");
    }

    /**
     * Creates a gateway whose client authenticates with the given credentials.
     *
     * @throws IOException if the client channel cannot be created
     */
    public static GoogleRecognitionGateway create(GoogleCredentials credentials) throws IOException {
        SpeechSettings settings = SpeechSettings.newBuilder()
                .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                .build();
        return new GoogleRecognitionGateway(SpeechClient.create(settings));
    }

    @Override
    public RecognitionStream open(RecognitionProperties config, RecognitionListener listener) {
        StreamingRecognitionConfig streamingConfig = toStreamingConfig(config);
        GoogleRecognitionStream stream = new GoogleRecognitionStream(listener);
        try {
            ClientStream<StreamingRecognizeRequest> requests =
                    speechClient.streamingRecognizeCallable().splitCall(stream);
            stream.bind(requests, streamingConfig);
        } catch (RuntimeException e) {
            throw new StreamStartException("Failed to open streaming recognize call", e);
        }
        LOG.debug("Opened streaming recognize call: encoding={}, sampleRate={}, language={}, model={}",
                config.encoding(), config.sampleRateHertz(), config.languageCode(), config.model());
        return stream;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void close() {
        LOG.info("Closing Speech-to-Text client");
        speechClient.close();
    }

    // Package-private for tests
    static StreamingRecognitionConfig toStreamingConfig(RecognitionProperties config) {
        RecognitionConfig.AudioEncoding encoding = parseEncoding(config.encoding());
        RecognitionConfig recognitionConfig = RecognitionConfig.newBuilder()
                .setEncoding(encoding)
                .setSampleRateHertz(config.sampleRateHertz())
                .setLanguageCode(config.languageCode())
                .setEnableAutomaticPunctuation(config.enableAutomaticPunctuation())
                .setModel(config.model())
                .build();
        return StreamingRecognitionConfig.newBuilder()
                .setConfig(recognitionConfig)
                .setInterimResults(config.interimResults())
                .build();
    }

    private static RecognitionConfig.AudioEncoding parseEncoding(String name) {
        try {
            RecognitionConfig.AudioEncoding encoding = RecognitionConfig.AudioEncoding.valueOf(name);
            if (encoding == RecognitionConfig.AudioEncoding.UNRECOGNIZED) {
                throw new IllegalArgumentException(name);
            }
            return encoding;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new StreamStartException("Unsupported audio encoding: " + name, e);
        }
    }
}
