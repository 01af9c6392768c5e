package com.phillippitts.peervoice.service.interaction;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Whether captured frames reach the classifier. Read by the capture loop once per frame; written
 * only by the state machine and the playback coordinator.
 */
public final class MicrophoneGate {

    public enum Mode { INACTIVE, ACTIVE, SUSPENDED_FOR_PLAYBACK }

    private final AtomicReference<Mode> mode = new AtomicReference<>(Mode.INACTIVE);

    public Mode mode() {
        return mode.get();
    }

    public boolean isOpen() {
        return mode.get() == Mode.ACTIVE;
    }

    public void activate() {
        mode.set(Mode.ACTIVE);
    }

    public void deactivate() {
        mode.set(Mode.INACTIVE);
    }

    /**
     * Suspends capture for playback.
     *
     * @return the mode to restore afterwards
     */
    Mode suspendForPlayback() {
        return mode.getAndSet(Mode.SUSPENDED_FOR_PLAYBACK);
    }

    /**
     * Restores {@code previous} unless someone changed the mode during playback.
     */
    void restoreAfterPlayback(Mode previous) {
        mode.compareAndSet(Mode.SUSPENDED_FOR_PLAYBACK, previous);
    }
}
