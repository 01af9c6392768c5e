package com.phillippitts.peervoice.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of speaking one utterance.
 *
 * @param success       whether audio was produced and played
 * @param audioDuration measured or estimated playback duration
 */
public record SynthesisResult(boolean success, Duration audioDuration) {

    public SynthesisResult {
        Objects.requireNonNull(audioDuration, "audioDuration must not be null");
    }
}
