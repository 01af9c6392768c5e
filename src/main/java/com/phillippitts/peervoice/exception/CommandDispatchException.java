package com.phillippitts.peervoice.exception;

/**
 * Thrown when the command dispatcher fails to execute an intent.
 */
public class CommandDispatchException extends PeerVoiceException {

    private final String intentType;

    public CommandDispatchException(String message, String intentType) {
        super(message + " (intent: " + intentType + ")");
        this.intentType = intentType;
    }

    public CommandDispatchException(String message, String intentType, Throwable cause) {
        super(message + " (intent: " + intentType + ")", cause);
        this.intentType = intentType;
    }

    public String getIntentType() {
        return intentType;
    }
}
