package com.phillippitts.peervoice.service.interaction;

import java.util.concurrent.atomic.AtomicBoolean;

/** Activates once per {@link #requestActivation()} call. */
public final class ManualActivationTrigger implements ActivationTrigger {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    @Override
    public boolean shouldActivate() {
        return requested.getAndSet(false);
    }

    @Override
    public void requestActivation() {
        requested.set(true);
    }
}
