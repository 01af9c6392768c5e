package com.phillippitts.peervoice.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p>Used by {@link com.phillippitts.peervoice.service.process.ProcessRunner},
 * {@link com.phillippitts.peervoice.service.audio.capture.JavaSoundAudioFrameSource}
 * and the long-running loops of the interaction pipeline.
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the capture thread to terminate once its line has been stopped.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for a processing loop (batcher, pipeline, state machine) to exit after being signalled.
     */
    public static final Duration LOOP_JOIN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Upper bound on waiting for outstanding final transcriptions during shutdown.
     */
    public static final Duration FINAL_TRANSCRIPTION_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
