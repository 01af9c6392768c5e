package com.phillippitts.peervoice.service.stt;

import com.phillippitts.peervoice.domain.TranscriptionResult;
import com.phillippitts.peervoice.exception.TranscriptionException;
import jakarta.annotation.PreDestroy;

/**
 * Lifecycle template for recognizers.
 *
 * <p>{@link #initialize()} and {@link #close()} are idempotent and synchronized on an internal
 * lock; subclasses supply {@link #doInitialize()}, {@link #doClose()} and
 * {@link #doRecognize(float[], boolean)}. Input validation and error wrapping happen here so every
 * backend fails the same way.
 */
public abstract class AbstractSpeechRecognizer implements SpeechRecognizer {

    protected final Object lock = new Object();

    /** Guarded by {@link #lock}. */
    protected boolean initialized = false;

    /** Guarded by {@link #lock}. */
    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            closed = false;
            initialized = true;
        }
    }

    /**
     * Backend-specific initialization, called under the lock.
     *
     * @throws TranscriptionException or a configuration exception on failure
     */
    protected abstract void doInitialize();

    @Override
    public final TranscriptionResult recognize(float[] samples, boolean requestAlignment) {
        if (samples == null || samples.length == 0) {
            throw new IllegalArgumentException("samples must not be null or empty");
        }
        ensureInitialized();
        try {
            return doRecognize(samples, requestAlignment);
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TranscriptionException(
                    getEngineName() + " recognition failed: " + e.getMessage(), getEngineName(), e);
        }
    }

    protected abstract TranscriptionResult doRecognize(float[] samples, boolean requestAlignment);

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Backend-specific cleanup, called under the lock. Must not throw.
     */
    protected abstract void doClose();

    private void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new TranscriptionException("recognizer not initialized or closed", getEngineName());
            }
        }
    }
}
