package com.phillippitts.peervoice.service.command;

import com.phillippitts.peervoice.domain.CommandResult;
import com.phillippitts.peervoice.domain.Intent;
import com.phillippitts.peervoice.exception.CommandDispatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Answers the built-in commands locally.
 */
public final class BuiltinCommandDispatcher implements CommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(BuiltinCommandDispatcher.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEEE d MMMM yyyy", Locale.ENGLISH);

    private final Clock clock;
    private final String version;

    public BuiltinCommandDispatcher(Clock clock, String version) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.version = version == null ? "unknown" : version;
    }

    @Override
    public CommandResult dispatch(Intent intent) {
        Objects.requireNonNull(intent, "intent must not be null");
        LOG.debug("Dispatching intent type={}", intent.type());
        LocalDateTime now = LocalDateTime.now(clock);
        return switch (intent.type()) {
            case "help" -> CommandResult.ok("you can ask for the time, the date, the status, the version, "
                    + "my capabilities, or say echo followed by a phrase");
            case "status" -> CommandResult.ok("all systems are running");
            case "time" -> CommandResult.ok("it is " + TIME.format(now));
            case "date" -> CommandResult.ok("today is " + DATE.format(now));
            case "version" -> CommandResult.ok("version " + version);
            case "capabilities" -> CommandResult.ok("I can listen, confirm what you asked for, and answer simple questions");
            case "echo" -> {
                String text = intent.parameters().getOrDefault("text", "");
                yield CommandResult.ok(text.isBlank() ? "nothing to repeat" : text);
            }
            case Intent.QUIT -> CommandResult.ok("goodbye");
            default -> throw new CommandDispatchException("No handler for intent type", intent.type());
        };
    }
}
