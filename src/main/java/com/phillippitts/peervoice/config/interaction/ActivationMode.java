package com.phillippitts.peervoice.config.interaction;

/**
 * How an idle session starts listening.
 */
public enum ActivationMode {
    /** Listening starts only when triggered through the API. */
    MANUAL,
    /** Listening restarts as soon as the session is idle. */
    CONTINUOUS
}
