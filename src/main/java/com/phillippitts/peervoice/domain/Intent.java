package com.phillippitts.peervoice.domain;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * What the user asked for, as understood by the intent extractor.
 *
 * @param rawText      utterance the intent was extracted from
 * @param type         intent type, lower case (e.g. "time", "help", "quit")
 * @param parameters   extracted parameters; copied to an immutable map
 * @param confidence   confidence between 0.0 and 1.0
 * @param humanSummary short description read back to the user during confirmation
 */
public record Intent(
        String rawText,
        String type,
        Map<String, String> parameters,
        double confidence,
        String humanSummary
) {
    public static final String UNKNOWN = "unknown";
    public static final String QUIT = "quit";

    public Intent {
        Objects.requireNonNull(rawText, "rawText must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        if (humanSummary == null || humanSummary.isBlank()) {
            humanSummary = summarize(type, parameters);
        }
    }

    public static Intent of(String rawText, String type, Map<String, String> parameters, double confidence) {
        return new Intent(rawText, type, parameters, confidence, null);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(type);
    }

    /**
     * Default summary: the type followed by the parameter values in key order.
     */
    static String summarize(String type, Map<String, String> parameters) {
        if (parameters.isEmpty()) {
            return type;
        }
        String values = parameters.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .collect(Collectors.joining(", "));
        return type + " (" + values + ")";
    }
}
