package com.phillippitts.speechrelay.service.session;

import com.phillippitts.speechrelay.config.properties.RecognitionProperties;
import com.phillippitts.speechrelay.domain.RecognitionResponse;
import com.phillippitts.speechrelay.domain.StreamState;
import com.phillippitts.speechrelay.exception.RecognitionUnavailableException;
import com.phillippitts.speechrelay.exception.StreamClosedException;
import com.phillippitts.speechrelay.service.metrics.RelayMetrics;
import com.phillippitts.speechrelay.service.stt.RecognitionGateway;
import com.phillippitts.speechrelay.service.stt.RecognitionListener;
import com.phillippitts.speechrelay.service.stt.RecognitionStream;
import com.phillippitts.speechrelay.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-connection controller binding a client connection to at most one upstream
 * recognition stream.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE      → STREAMING (onStart, backend available and stream opened)
 * IDLE      → IDLE      (onStart, backend unavailable or open failed; error sent)
 * STREAMING → IDLE      (onStop, onDisconnect, upstream end, upstream error)
 * STREAMING → STREAMING (onAudioChunk forwards bytes)
 * IDLE      → IDLE      (onAudioChunk drops bytes)
 * </pre>
 *
 * <p><b>Thread Safety:</b> client events arrive one at a time from the transport, while
 * upstream events arrive on the gateway's threads. {@code current} and {@code ended} are
 * guarded by a {@link ReentrantLock}; the lock is never held while writing to or ending a
 * stream, while waiting for a stream to close, or while sending to the client.
 *
 * <p>Each opened stream gets its own {@link StreamBinding}. Upstream events from a binding that
 * is no longer current (stopped or replaced) are still relayed to the client, so final results
 * after a stop are not lost, but they never change the session's state.
 *
 * @since 1.0
 */
public final class StreamingSession {

    private static final Logger LOG = LogManager.getLogger(StreamingSession.class);

    public static final String NOT_CONFIGURED = "Speech-to-Text service is not configured";
    public static final String RECOGNITION_ERROR_PREFIX = "Speech recognition error: ";
    public static final String AUDIO_FAILED = "Failed to process audio data";
    public static final String START_FAILED = "Failed to start stream";

    private static final int TRANSCRIPT_PREVIEW_CHARS = 40;

    private final ClientChannel channel;
    private final RecognitionGateway gateway;
    private final RecognitionProperties recognition;
    private final Duration restartTimeout;
    private final RelayMetrics metrics;

    private final Lock lock = new ReentrantLock();
    private StreamBinding current;
    private StreamBinding draining;
    private boolean ended = true;

    public StreamingSession(ClientChannel channel,
                            RecognitionGateway gateway,
                            RecognitionProperties recognition,
                            Duration restartTimeout,
                            RelayMetrics metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.recognition = Objects.requireNonNull(recognition, "recognition");
        this.restartTimeout = Objects.requireNonNull(restartTimeout, "restartTimeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public String connectionId() {
        return channel.id();
    }

    public StreamState state() {
        lock.lock();
        try {
            return current != null && !ended ? StreamState.STREAMING : StreamState.IDLE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens a new upstream stream. A stream that is still live is ended first, and the
     * previous stream gets up to the restart timeout to confirm closure before the new one
     * is opened.
     */
    public void onStart() {
        if (!gateway.isAvailable()) {
            LOG.warn("startStream rejected: {}", gateway.unavailableReason().orElse("backend unavailable"));
            metrics.error(RelayMetrics.ERROR_NOT_CONFIGURED);
            channel.sendError(NOT_CONFIGURED);
            return;
        }

        retirePreviousStream();

        StreamBinding binding = new StreamBinding();
        RecognitionStream stream;
        try {
            stream = gateway.open(recognition, binding);
        } catch (RecognitionUnavailableException e) {
            LOG.warn("startStream rejected: {}", e.getReason());
            metrics.error(RelayMetrics.ERROR_NOT_CONFIGURED);
            channel.sendError(NOT_CONFIGURED);
            return;
        } catch (RuntimeException e) {
            LOG.error("Error starting stream", e);
            metrics.error(RelayMetrics.ERROR_START_FAILED);
            channel.sendError(START_FAILED);
            return;
        }

        boolean installed;
        lock.lock();
        try {
            binding.stream = stream;
            installed = !binding.terminated;
            if (installed) {
                current = binding;
                ended = false;
            }
        } finally {
            lock.unlock();
        }

        if (installed) {
            metrics.streamStarted();
            LOG.info("Recognition stream started");
        } else {
            LOG.warn("Recognition stream terminated before it could be installed");
        }
    }

    /**
     * Forwards one audio chunk, unchanged, to the live stream. Dropped silently when no
     * stream is live.
     */
    public void onAudioChunk(byte[] audio) {
        RecognitionStream target;
        lock.lock();
        try {
            target = current != null && !ended ? current.stream : null;
        } finally {
            lock.unlock();
        }

        if (target == null) {
            metrics.chunkDropped();
            LOG.trace("Dropped audio chunk of {} bytes: no active stream", audio.length);
            return;
        }

        try {
            target.write(audio);
            metrics.audioForwarded(audio.length);
        } catch (RuntimeException e) {
            LOG.error("Error writing to stream", e);
            metrics.error(RelayMetrics.ERROR_WRITE_FAILED);
            channel.sendError(AUDIO_FAILED);
        }
    }

    /**
     * Requests graceful closure of the live stream. No-op when there is none.
     */
    public void onStop() {
        StreamBinding binding = detachCurrent();
        if (binding == null) {
            LOG.debug("endStream ignored: no active stream");
            return;
        }
        endQuietly(binding, "Error ending stream");
    }

    /**
     * Connection lost: same effect as {@link #onStop()}.
     */
    public void onDisconnect() {
        StreamBinding binding = detachCurrent();
        if (binding != null) {
            endQuietly(binding, "Error ending stream on disconnect");
        }
    }

    private void retirePreviousStream() {
        StreamBinding live = detachCurrent();
        if (live != null) {
            LOG.warn("startStream received while a stream is active; ending previous stream");
            endQuietly(live, "Error ending previous stream");
        }

        StreamBinding toAwait;
        lock.lock();
        try {
            toAwait = draining;
            draining = null;
        } finally {
            lock.unlock();
        }

        if (toAwait != null && !toAwait.awaitClosed(restartTimeout)) {
            LOG.warn("Previous stream did not confirm closure within {} ms; opening new stream anyway",
                    restartTimeout.toMillis());
        }
    }

    private StreamBinding detachCurrent() {
        lock.lock();
        try {
            if (current == null || ended) {
                return null;
            }
            StreamBinding binding = current;
            ended = true;
            current = null;
            draining = binding;
            return binding;
        } finally {
            lock.unlock();
        }
    }

    private void endQuietly(StreamBinding binding, String failureMessage) {
        try {
            binding.stream.end();
        } catch (RuntimeException e) {
            LOG.error(failureMessage, e);
            metrics.error(RelayMetrics.ERROR_CLOSE_FAILED);
        }
    }

    /**
     * Routes the events of one upstream stream into the session.
     */
    private final class StreamBinding implements RecognitionListener {

        private final CountDownLatch closed = new CountDownLatch(1);
        // guarded by lock
        private RecognitionStream stream;
        private boolean terminated;

        @Override
        public void onData(RecognitionResponse response) {
            response.firstTranscript().ifPresent(text -> {
                try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("connectionId", connectionId())) {
                    LOG.debug("Transcription: '{}'", LogSanitizer.preview(text, TRANSCRIPT_PREVIEW_CHARS));
                }
                metrics.transcriptionEmitted();
                channel.sendTranscription(text);
            });
        }

        @Override
        public void onError(Throwable error) {
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("connectionId", connectionId())) {
                if (StreamClosedException.isWriteAfterEnd(error)) {
                    LOG.debug("Ignoring write after end");
                    return;
                }
                LOG.error("Speech recognition error: {}", error.getMessage(), error);
            }
            terminate();
            metrics.error(RelayMetrics.ERROR_RECOGNITION);
            channel.sendError(RECOGNITION_ERROR_PREFIX + error.getMessage());
        }

        @Override
        public void onEnd() {
            terminate();
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("connectionId", connectionId())) {
                LOG.info("Recognition stream ended");
            }
        }

        private void terminate() {
            lock.lock();
            try {
                terminated = true;
                if (current == this) {
                    current = null;
                    ended = true;
                }
                if (draining == this) {
                    draining = null;
                }
            } finally {
                lock.unlock();
            }
            closed.countDown();
        }

        boolean awaitClosed(Duration timeout) {
            try {
                return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
