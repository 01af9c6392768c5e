package com.phillippitts.peervoice.service.batch;

/** Lifecycle of a {@link SpeechBatch}. */
public enum BatchState {
    /** Receiving speech. */
    ACTIVE,
    /** Silence observed, but not long enough to finalize. */
    PAUSED,
    /** Finalized; no further segments accepted. */
    COMPLETED
}
