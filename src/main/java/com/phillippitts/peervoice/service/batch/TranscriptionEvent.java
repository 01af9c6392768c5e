package com.phillippitts.peervoice.service.batch;

import com.phillippitts.peervoice.domain.TranscriptionResult;

import java.util.Objects;

/**
 * A partial or final transcription for a batch, delivered through {@link SpeechBatcher#pollEvent}.
 */
public record TranscriptionEvent(long batchId, TranscriptionResult result) {

    public TranscriptionEvent {
        Objects.requireNonNull(result, "result must not be null");
    }

    public String text() {
        return result.text();
    }

    public boolean isFinal() {
        return result.isFinal();
    }
}
