package com.phillippitts.speechrelay.service.stt.google;

import com.google.api.gax.rpc.ClientStream;
import com.google.api.gax.rpc.ResponseObserver;
import com.google.api.gax.rpc.StreamController;
import com.google.cloud.speech.v1.StreamingRecognitionConfig;
import com.google.cloud.speech.v1.StreamingRecognizeRequest;
import com.google.cloud.speech.v1.StreamingRecognizeResponse;
import com.google.protobuf.ByteString;
import com.phillippitts.speechrelay.exception.AudioForwardingException;
import com.phillippitts.speechrelay.exception.StreamClosedException;
import com.phillippitts.speechrelay.service.stt.RecognitionListener;
import com.phillippitts.speechrelay.service.stt.RecognitionStream;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One {@code streamingRecognize} call: the request half is driven through {@link #write}/{@link #end},
 * the response half is observed here and translated into {@link RecognitionListener} events.
 *
 * <p>Exactly one terminal event (error or end) is delivered to the listener for the call itself.
 * Writes after {@link #end()} or after the call finished are reported as
 * {@link StreamClosedException} errors instead of reaching gRPC, which would reject them.
 */
final class GoogleRecognitionStream implements RecognitionStream, ResponseObserver<StreamingRecognizeResponse> {

    private final RecognitionListener listener;
    private final AtomicBoolean halfClosed = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile ClientStream<StreamingRecognizeRequest> requests;

    GoogleRecognitionStream(RecognitionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    void bind(ClientStream<StreamingRecognizeRequest> requests, StreamingRecognitionConfig config) {
        this.requests = requests;
        requests.send(StreamingRecognizeRequest.newBuilder()
                .setStreamingConfig(config)
                .build());
    }

    @Override
    public void write(byte[] audio) {
        if (halfClosed.get() || finished.get()) {
            listener.onError(new StreamClosedException());
            return;
        }
        try {
            requests.send(StreamingRecognizeRequest.newBuilder()
                    .setAudioContent(ByteString.copyFrom(audio))
                    .build());
        } catch (RuntimeException e) {
            throw new AudioForwardingException(audio.length, e);
        }
    }

    @Override
    public void end() {
        if (!halfClosed.compareAndSet(false, true) || finished.get()) {
            return;
        }
        requests.closeSend();
    }

    @Override
    public void onStart(StreamController controller) {
        // automatic flow control
    }

    @Override
    public void onResponse(StreamingRecognizeResponse response) {
        listener.onData(RecognitionResponseMapper.toResponse(response));
    }

    @Override
    public void onError(Throwable t) {
        if (finished.compareAndSet(false, true)) {
            listener.onError(t);
        }
    }

    @Override
    public void onComplete() {
        if (finished.compareAndSet(false, true)) {
            listener.onEnd();
        }
    }
}
