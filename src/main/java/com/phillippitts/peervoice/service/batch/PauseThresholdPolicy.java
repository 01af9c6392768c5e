package com.phillippitts.peervoice.service.batch;

import com.phillippitts.peervoice.config.batching.BatchingProperties;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides when a pause ends an utterance.
 *
 * <p>Short-pause shortcut: a batch with at least {@code minSegmentsForFinal} segments and
 * {@code minContentMs} of audio finalizes after {@code shortPauseMs} of silence. Otherwise the
 * long-pause threshold applies; it grows with the batch once the batch is longer than
 * {@code longPauseScaleReferenceMs}, capped at {@code longPauseMaxScale} times the base.
 */
public final class PauseThresholdPolicy {

    private final BatchingProperties props;

    public PauseThresholdPolicy(BatchingProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    public Duration longPauseThreshold(Duration batchDuration) {
        long base = props.getLongPauseBaseMs();
        long reference = props.getLongPauseScaleReferenceMs();
        long durationMs = batchDuration.toMillis();
        if (durationMs <= reference) {
            return Duration.ofMillis(base);
        }
        double scale = Math.min(props.getLongPauseMaxScale(), (double) durationMs / reference);
        return Duration.ofMillis(Math.round(base * scale));
    }

    public boolean isShortcutEligible(int segmentCount, Duration batchDuration) {
        return segmentCount >= props.getMinSegmentsForFinal()
                && batchDuration.toMillis() >= props.getMinContentMs();
    }

    /**
     * @return the finalization reason, or empty when the batch should keep waiting
     */
    public Optional<FinalizationReason> evaluate(int segmentCount, Duration batchDuration, Duration pause) {
        if (pause.isNegative()) {
            return Optional.empty();
        }
        if (isShortcutEligible(segmentCount, batchDuration) && pause.toMillis() >= props.getShortPauseMs()) {
            return Optional.of(FinalizationReason.PAUSE);
        }
        if (pause.compareTo(longPauseThreshold(batchDuration)) >= 0) {
            return Optional.of(FinalizationReason.LONG_PAUSE);
        }
        return Optional.empty();
    }
}
