package com.phillippitts.peervoice.exception;

/**
 * Thrown when a speech recognizer fails to transcribe audio.
 * This may occur due to engine errors, timeout, or an unusable model.
 */
public class TranscriptionException extends PeerVoiceException {

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
