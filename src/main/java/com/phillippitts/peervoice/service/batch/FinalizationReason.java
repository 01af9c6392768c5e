package com.phillippitts.peervoice.service.batch;

/** Why a batch was finalized. */
public enum FinalizationReason {
    /** Short pause after enough content. */
    PAUSE,
    /** Adaptive long pause elapsed. */
    LONG_PAUSE,
    /** Accumulated audio exceeded the hard cap. */
    MAX_DURATION,
    /** Requested by the caller, e.g. when the listening window expires. */
    FORCED,
    /** Flushed while stopping. */
    SHUTDOWN
}
