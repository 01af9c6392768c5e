package com.phillippitts.peervoice.exception;

/**
 * Base exception for all peer-voice application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PeerVoiceException extends RuntimeException {

    public PeerVoiceException(String message) {
        super(message);
    }

    public PeerVoiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
