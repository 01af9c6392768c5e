package com.phillippitts.peervoice.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One fixed-size chunk of raw PCM16 mono audio as delivered by the capture device.
 *
 * <p>The sample array is copied on construction; callers must treat the array returned
 * by {@link #samples()} as read-only.
 *
 * @param samples    signed 16-bit PCM samples (never null, may be empty)
 * @param sampleRate sample rate in Hz
 * @param capturedAt when the last sample of the frame was read from the device
 */
public record AudioFrame(short[] samples, int sampleRate, Instant capturedAt) {

    public AudioFrame {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        samples = samples.clone();
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    public Duration duration() {
        return Duration.ofNanos((long) samples.length * 1_000_000_000L / sampleRate);
    }
}
