package com.phillippitts.peervoice.service.audio.capture;

import com.phillippitts.peervoice.domain.AudioFrame;

import java.time.Duration;
import java.util.Optional;

/**
 * Source of fixed-size PCM frames from a capture device.
 *
 * <p>Implementations read the device on their own thread and buffer frames in a bounded queue;
 * {@link #captureFrame(Duration)} only blocks on that queue.
 */
public interface AudioFrameSource extends AutoCloseable {

    /**
     * Opens the device and begins buffering frames. Idempotent.
     */
    void start();

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return the frame, or empty on timeout
     */
    Optional<AudioFrame> captureFrame(Duration timeout);

    /**
     * Discards all buffered frames.
     */
    void drain();

    boolean isRunning();

    /**
     * Stops reading and releases the device. Idempotent.
     */
    @Override
    void close();
}
