package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.domain.CommandResult;
import com.phillippitts.peervoice.domain.Intent;

import java.util.Locale;
import java.util.Map;

/**
 * Builds the sentence announced after a command completes: an intent-specific prefix followed by
 * the command's message.
 */
final class CompletionFeedback {

    static final String DEFAULT_PREFIX = "I handled your request. Here is the result:";
    static final String NO_MESSAGE = "The command completed successfully.";

    private static final Map<String, String> PREFIXES = Map.of(
            "help", "I looked up the help. Here is what I found:",
            "status", "I checked the system status:",
            "time", "I checked the clock:",
            "date", "I checked the date:",
            "version", "I looked up the version:",
            "capabilities", "Here is what I can do:",
            "echo", "I received your message and repeat it:",
            Intent.QUIT, "Shutting down now.",
            "analyze", "The analysis is complete. Here are the results:",
            "analysis", "The analysis is complete. Here is what I found:");

    private CompletionFeedback() {}

    static String format(Intent intent, CommandResult result) {
        String type = intent.type().toLowerCase(Locale.ROOT);
        String prefix = PREFIXES.getOrDefault(type, DEFAULT_PREFIX);
        if (Intent.QUIT.equals(type)) {
            return prefix;
        }
        String message = result == null ? null : result.message();
        return message == null || message.isBlank() ? prefix + " " + NO_MESSAGE : prefix + " " + message;
    }
}
