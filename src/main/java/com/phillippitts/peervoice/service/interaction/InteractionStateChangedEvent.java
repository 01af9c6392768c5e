package com.phillippitts.peervoice.service.interaction;

import java.time.Instant;
import java.util.Objects;

/**
 * Published on every state transition.
 */
public record InteractionStateChangedEvent(InteractionState from, InteractionState to, Instant at) {

    public InteractionStateChangedEvent {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(at, "at");
    }
}
