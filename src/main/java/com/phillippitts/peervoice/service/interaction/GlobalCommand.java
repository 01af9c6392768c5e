package com.phillippitts.peervoice.service.interaction;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Commands honoured in every state, before any other processing.
 * Keywords are English and French, lower case.
 */
public enum GlobalCommand {
    STOP(Set.of("stop", "arrête", "arrêter")),
    CANCEL(Set.of("cancel", "annule", "annuler")),
    PAUSE(Set.of("pause", "wait", "attends")),
    RESUME(Set.of("resume", "reprends", "continue")),
    RESTART(Set.of("restart", "recommence"));

    private final Set<String> keywords;

    GlobalCommand(Set<String> keywords) {
        this.keywords = keywords;
    }

    public Set<String> keywords() {
        return keywords;
    }

    /**
     * Parses a command name such as {@code "stop"} or {@code "RESUME"}.
     */
    public static Optional<GlobalCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (GlobalCommand command : values()) {
            if (command.name().equals(normalized)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
