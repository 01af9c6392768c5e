package com.phillippitts.peervoice.service.audio.segment;

/**
 * Speech / non-speech verdict for one frame of normalised mono samples.
 *
 * <p>Implementations must be deterministic for a given frame and configuration and must not keep
 * per-stream state; the segment classifier relies on that to stay repeatable. A dedicated model
 * (e.g. an ONNX VAD) can be plugged in by exposing a bean of this type.
 */
public interface VoiceActivityDetector {

    /**
     * @param samples    normalised samples in [-1, 1], never empty
     * @param sampleRate sample rate in Hz
     * @return true when the frame contains speech
     */
    boolean isSpeech(float[] samples, int sampleRate);

    /**
     * Short identifier for logs and health details.
     */
    String name();
}
