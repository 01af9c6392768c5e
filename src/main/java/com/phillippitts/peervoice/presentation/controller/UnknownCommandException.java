package com.phillippitts.peervoice.presentation.controller;

import com.phillippitts.peervoice.exception.PeerVoiceException;

/**
 * Thrown when a REST caller names a global command that does not exist.
 */
public class UnknownCommandException extends PeerVoiceException {

    private final String command;

    public UnknownCommandException(String command) {
        super("Unknown command: " + command);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
