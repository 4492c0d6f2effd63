package com.phillippitts.speechrelay.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for the relay.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Client connections opened/closed and currently active</li>
 *   <li>Upstream streams started</li>
 *   <li>Audio bytes forwarded and chunks dropped for lack of a stream</li>
 *   <li>Transcriptions emitted and errors by category</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class RelayMetrics {

    private static final String METRIC_PREFIX = "speechrelay";

    public static final String ERROR_NOT_CONFIGURED = "not_configured";
    public static final String ERROR_START_FAILED = "start_failed";
    public static final String ERROR_WRITE_FAILED = "write_failed";
    public static final String ERROR_RECOGNITION = "recognition";
    public static final String ERROR_CLOSE_FAILED = "close_failed";

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void sessionOpened() {
        counter("sessions.opened", "Number of client connections opened").increment();
    }

    public void sessionClosed() {
        counter("sessions.closed", "Number of client connections closed").increment();
    }

    public void streamStarted() {
        counter("streams.started", "Number of upstream recognition streams opened").increment();
    }

    /**
     * @param bytes size of the chunk that reached the upstream stream
     */
    public void audioForwarded(int bytes) {
        counter("audio.forwarded.bytes", "Audio bytes forwarded upstream").increment(bytes);
    }

    public void chunkDropped() {
        counter("audio.dropped", "Audio chunks dropped because no stream was live").increment();
    }

    public void transcriptionEmitted() {
        counter("transcriptions", "Transcription events sent to clients").increment();
    }

    /**
     * @param category one of the {@code ERROR_*} constants
     */
    public void error(String category) {
        Counter.builder(METRIC_PREFIX + ".errors")
                .description("Errors by category")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge reporting the number of connected clients.
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Currently connected clients")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .register(registry);
    }
}
