package com.phillippitts.peervoice.exception;

/**
 * Thrown when a recognizer model or binary configured at startup does not exist.
 * This is a configuration error and fails application startup.
 */
public class ModelNotFoundException extends PeerVoiceException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Model or binary not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
