package com.phillippitts.peervoice.service.batch;

import com.phillippitts.peervoice.domain.AudioSegment;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One utterance in progress: ordered speech segments plus their concatenated samples.
 *
 * <p>The accumulated samples always equal the in-order concatenation of {@link #getSegments()}
 * and the last activity time never moves backwards. Mutators are package-private and only called
 * by {@link SpeechBatcher} under its batch lock; getters return copies.
 */
public final class SpeechBatch {

    private static final int INITIAL_CAPACITY = 16_000;

    private final long id;
    private final int sampleRate;
    private final Instant startTime;
    private final List<AudioSegment> segments = new ArrayList<>();
    private float[] buffer = new float[INITIAL_CAPACITY];
    private int length;
    private volatile Instant lastActivity;
    private volatile BatchState state = BatchState.ACTIVE;
    private volatile FinalizationReason finalizationReason;

    SpeechBatch(long id, int sampleRate, Instant startTime) {
        this.id = id;
        this.sampleRate = sampleRate;
        this.startTime = startTime;
        this.lastActivity = startTime;
    }

    void append(AudioSegment segment) {
        if (state == BatchState.COMPLETED) {
            throw new IllegalStateException("batch " + id + " is already completed");
        }
        float[] samples = segment.samples();
        ensureCapacity(length + samples.length);
        System.arraycopy(samples, 0, buffer, length, samples.length);
        length += samples.length;
        segments.add(segment);
        Instant end = segment.timestamp().plus(segment.duration());
        if (end.isAfter(lastActivity)) {
            lastActivity = end;
        }
        state = BatchState.ACTIVE;
    }

    void markPaused() {
        if (state == BatchState.ACTIVE) {
            state = BatchState.PAUSED;
        }
    }

    void complete(FinalizationReason reason) {
        this.finalizationReason = reason;
        this.state = BatchState.COMPLETED;
    }

    /**
     * Copy of the last {@code maxSamples} accumulated samples.
     */
    float[] tail(int maxSamples) {
        int n = Math.min(maxSamples, length);
        return Arrays.copyOfRange(buffer, length - n, length);
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }

    public long getId() {
        return id;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public BatchState getState() {
        return state;
    }

    /** Null until the batch is completed. */
    public FinalizationReason getFinalizationReason() {
        return finalizationReason;
    }

    public List<AudioSegment> getSegments() {
        return Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public int segmentCount() {
        return segments.size();
    }

    public float[] getSamples() {
        return Arrays.copyOf(buffer, length);
    }

    public int sampleCount() {
        return length;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public Duration duration() {
        return Duration.ofNanos((long) length * 1_000_000_000L / sampleRate);
    }

    @Override
    public String toString() {
        return "SpeechBatch{id=" + id + ", segments=" + segments.size() + ", durationMs="
                + duration().toMillis() + ", state=" + state + '}';
    }
}
