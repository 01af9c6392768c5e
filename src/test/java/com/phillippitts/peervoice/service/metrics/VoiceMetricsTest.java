package com.phillippitts.peervoice.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceMetricsTest {

    private MeterRegistry registry;
    private VoiceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new VoiceMetrics(registry);
    }

    @Test
    void shouldCountFinalizedBatchesPerLowerCaseReason() {
        metrics.recordBatchFinalized("PAUSE");
        metrics.recordBatchFinalized("PAUSE");
        metrics.recordBatchFinalized("MAX_DURATION");

        assertThat(registry.find("peervoice.batch.finalized").tag("reason", "pause").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("peervoice.batch.finalized").tag("reason", "max_duration").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordLatencyPerKind() {
        long nanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordTranscriptionLatency("final", nanos);

        Timer timer = registry.find("peervoice.transcription.latency").tag("kind", "final").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(nanos);
    }

    @Test
    void shouldCountFailuresByKindAndReason() {
        metrics.incrementTranscriptionFailure("partial", "timeout");

        Counter counter = registry.find("peervoice.transcription.failure")
                .tag("kind", "partial")
                .tag("reason", "timeout")
                .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountEchoesAndCommandOutcomes() {
        metrics.incrementEchoSuppressed();
        metrics.incrementCommandDispatched("success");
        metrics.incrementCommandDispatched("timeout");

        assertThat(registry.find("peervoice.echo.suppressed").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("peervoice.command.dispatched").tag("outcome", "timeout").counter().count())
                .isEqualTo(1.0);
    }
}
