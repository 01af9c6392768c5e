package com.phillippitts.peervoice.config.interaction;

import com.phillippitts.peervoice.config.batching.BatchingProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Cross-field checks that bean validation cannot express. Fails startup with an actionable
 * message before any loop starts.
 */
@Component
class InteractionConfigurationValidator {

    private final BatchingProperties batching;
    private final InteractionProperties interaction;

    InteractionConfigurationValidator(BatchingProperties batching, InteractionProperties interaction) {
        this.batching = batching;
        this.interaction = interaction;
    }

    @PostConstruct
    void validate() {
        if (batching.getShortPauseMs() >= batching.getLongPauseBaseMs()) {
            throw new IllegalArgumentException("batching.short-pause-ms (" + batching.getShortPauseMs()
                    + ") must be less than batching.long-pause-base-ms (" + batching.getLongPauseBaseMs() + ")");
        }
        if (batching.getMinSegmentMs() >= batching.getMaxBatchMs()) {
            throw new IllegalArgumentException("batching.min-segment-ms (" + batching.getMinSegmentMs()
                    + ") must be less than batching.max-batch-ms (" + batching.getMaxBatchMs() + ")");
        }
        if (batching.getPartialWindowMs() > batching.getMaxBatchMs()) {
            throw new IllegalArgumentException("batching.partial-window-ms (" + batching.getPartialWindowMs()
                    + ") must not exceed batching.max-batch-ms (" + batching.getMaxBatchMs() + ")");
        }
        requireUnitInterval("interaction.high-confidence-threshold", interaction.getHighConfidenceThreshold());
        requireUnitInterval("interaction.echo-similarity-threshold", interaction.getEchoSimilarityThreshold());
        requireUnitInterval("interaction.quit-end-ratio", interaction.getQuitEndRatio());
        requireUnitInterval("interaction.playback-cooldown-ratio", interaction.getPlaybackCooldownRatio());
        String confirm = interaction.getPrompts().getConfirmIntent();
        if (confirm == null || !confirm.contains("%s")) {
            throw new IllegalArgumentException(
                    "interaction.prompts.confirm-intent must contain a %s placeholder for the intent summary");
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got: " + value);
        }
    }
}
