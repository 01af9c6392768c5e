package com.phillippitts.peervoice.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A classified span of audio: normalised samples plus the speech verdict and RMS energy.
 *
 * @param samples     float samples in [-1, 1]; copied on construction
 * @param sampleRate  sample rate in Hz
 * @param timestamp   capture instant of the span
 * @param duration    playback duration of {@code samples}
 * @param hasSpeech   voice activity verdict
 * @param energyLevel root-mean-square of {@code samples}
 */
public record AudioSegment(
        float[] samples,
        int sampleRate,
        Instant timestamp,
        Duration duration,
        boolean hasSpeech,
        double energyLevel
) {

    public AudioSegment {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (energyLevel < 0.0 || Double.isNaN(energyLevel)) {
            throw new IllegalArgumentException("energyLevel must be >= 0, got: " + energyLevel);
        }
        samples = samples.clone();
    }

    /**
     * Builds a segment whose duration is derived from the sample count.
     */
    public static AudioSegment of(float[] samples, int sampleRate, Instant timestamp,
                                  boolean hasSpeech, double energyLevel) {
        Duration duration = Duration.ofNanos((long) samples.length * 1_000_000_000L / sampleRate);
        return new AudioSegment(samples, sampleRate, timestamp, duration, hasSpeech, energyLevel);
    }

    /**
     * Segment carrying no audio; used for empty or malformed frames.
     */
    public static AudioSegment silent(int sampleRate, Instant timestamp) {
        return new AudioSegment(new float[0], sampleRate, timestamp, Duration.ZERO, false, 0.0);
    }

    public int sampleCount() {
        return samples.length;
    }
}
