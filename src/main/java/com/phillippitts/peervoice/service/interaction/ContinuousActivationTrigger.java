package com.phillippitts.peervoice.service.interaction;

/** Always listening: every idle tick starts a new turn. */
public final class ContinuousActivationTrigger implements ActivationTrigger {

    @Override
    public boolean shouldActivate() {
        return true;
    }
}
