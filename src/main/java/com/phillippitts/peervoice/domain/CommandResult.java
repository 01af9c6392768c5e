package com.phillippitts.peervoice.domain;

/**
 * Response of the command dispatcher for one intent.
 *
 * @param success whether the command executed
 * @param message text to read back to the user (may be empty)
 */
public record CommandResult(boolean success, String message) {

    public CommandResult {
        message = message == null ? "" : message;
    }

    public static CommandResult ok(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult failed(String message) {
        return new CommandResult(false, message);
    }
}
