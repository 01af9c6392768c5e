package com.phillippitts.peervoice.exception;

/**
 * Thrown when an utterance cannot be turned into an intent because the extractor failed,
 * as opposed to the extractor returning an "unknown" intent.
 */
public class IntentExtractionException extends PeerVoiceException {

    public IntentExtractionException(String message) {
        super(message);
    }

    public IntentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
