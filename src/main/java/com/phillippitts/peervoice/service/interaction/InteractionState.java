package com.phillippitts.peervoice.service.interaction;

/**
 * States of the interaction turn loop.
 *
 * <pre>
 * IDLE → LISTENING → PROCESSING → INTENT_VALIDATION → AWAIT_RESPONSE → IDLE
 * any  → TERMINATED (stop)
 * </pre>
 */
public enum InteractionState {
    IDLE,
    LISTENING,
    PROCESSING,
    INTENT_VALIDATION,
    AWAIT_RESPONSE,
    TERMINATED
}
