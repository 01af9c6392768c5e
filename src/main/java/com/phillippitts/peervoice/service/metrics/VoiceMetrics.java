package com.phillippitts.peervoice.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the speech interaction pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Finalized batches per reason (pause, long_pause, max_duration, forced, shutdown)</li>
 *   <li>Recognizer latency and failures per request kind (partial, final)</li>
 *   <li>Suppressed echoes</li>
 *   <li>Command dispatch outcomes</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class VoiceMetrics {

    private static final String METRIC_PREFIX = "peervoice";

    private final MeterRegistry registry;

    public VoiceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatchFinalized(String reason) {
        Counter.builder(METRIC_PREFIX + ".batch.finalized")
                .description("Number of finalized speech batches")
                .tag("reason", reason.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * @param kind          "partial" or "final"
     * @param durationNanos recognizer call duration
     */
    public void recordTranscriptionLatency(String kind, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to transcribe a batch")
                .tag("kind", kind)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param kind   "partial" or "final"
     * @param reason failure reason (timeout, error)
     */
    public void incrementTranscriptionFailure(String kind, String reason) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Number of failed transcriptions")
                .tag("kind", kind)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementEchoSuppressed() {
        Counter.builder(METRIC_PREFIX + ".echo.suppressed")
                .description("Transcriptions discarded as the assistant's own voice")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success, failure or timeout
     */
    public void incrementCommandDispatched(String outcome) {
        Counter.builder(METRIC_PREFIX + ".command.dispatched")
                .description("Number of dispatched commands by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
