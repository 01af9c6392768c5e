package com.phillippitts.peervoice.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of a speech-to-text request.
 *
 * @param text       transcribed text (never null, empty when nothing was recognised)
 * @param confidence confidence between 0.0 and 1.0
 * @param isFinal    true for a full-batch transcription, false for a partial
 * @param timestamp  when the transcription completed
 * @param engineName recognizer that produced the result
 */
public record TranscriptionResult(
        String text,
        double confidence,
        boolean isFinal,
        Instant timestamp,
        String engineName
) {
    /**
     * Compact constructor with validation.
     *
     * <p>Empty text is valid: silence or unclear audio may produce no transcription.
     *
     * @throws IllegalArgumentException if confidence is out of range
     * @throws NullPointerException if text, timestamp, or engineName is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    public static TranscriptionResult of(String text, double confidence, boolean isFinal, String engineName) {
        return new TranscriptionResult(text, confidence, isFinal, Instant.now(), engineName);
    }

    /**
     * Result standing in for a failed or timed-out recognition.
     */
    public static TranscriptionResult empty(boolean isFinal, String engineName) {
        return new TranscriptionResult("", 0.0, isFinal, Instant.now(), engineName);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
