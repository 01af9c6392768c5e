package com.phillippitts.peervoice.exception;

/**
 * Thrown when the speech synthesizer cannot speak a text.
 */
public class SynthesisException extends PeerVoiceException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
