package com.phillippitts.peervoice.service.stt;

import com.phillippitts.peervoice.domain.TranscriptionResult;

/**
 * Speech-to-text backend used by the speech batcher.
 *
 * <p>Implementations must be safe for concurrent calls: a partial and a final request for
 * different batches can overlap.
 */
public interface SpeechRecognizer extends AutoCloseable {

    /**
     * Prepares the backend (validates models, loads resources). Idempotent.
     */
    void initialize();

    /**
     * Transcribes normalised mono samples at 16 kHz.
     *
     * @param samples          float samples in [-1, 1]
     * @param requestAlignment true for a final, accuracy-first request; false for a low-latency partial
     * @return result whose {@code isFinal} mirrors {@code requestAlignment}
     * @throws com.phillippitts.peervoice.exception.TranscriptionException on failure
     */
    TranscriptionResult recognize(float[] samples, boolean requestAlignment);

    String getEngineName();

    boolean isHealthy();

    @Override
    void close();
}
