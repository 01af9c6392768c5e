package com.phillippitts.peervoice.service.interaction;

/**
 * Decides when an idle session starts listening. Polled by the state machine on each tick in IDLE.
 */
public interface ActivationTrigger {

    /**
     * @return true to move from IDLE to LISTENING; consumes any pending request
     */
    boolean shouldActivate();

    /**
     * Requests activation (REST or programmatic). Triggers that are always on ignore it.
     */
    default void requestActivation() {
    }
}
