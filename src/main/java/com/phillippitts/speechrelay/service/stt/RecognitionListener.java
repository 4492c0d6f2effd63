package com.phillippitts.speechrelay.service.stt;

import com.phillippitts.speechrelay.domain.RecognitionResponse;

/**
 * Receives the asynchronous events of a single recognition stream.
 *
 * <p>{@link #onError} and {@link #onEnd} are terminal for the underlying call, except for
 * write-after-end errors which are reported while the stream is already finishing.
 */
public interface RecognitionListener {

    void onData(RecognitionResponse response);

    void onError(Throwable error);

    void onEnd();
}
