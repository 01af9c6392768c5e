package com.phillippitts.peervoice.service.intent;

import com.phillippitts.peervoice.domain.Intent;
import com.phillippitts.peervoice.util.TextTokens;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword-based extractor for the built-in commands.
 *
 * <p>Confidence is {@code min(0.8, 0.3 * matches)}; a one-word utterance that is itself a keyword
 * scores 0.7. Anything without a match is {@link Intent#UNKNOWN} at 0.5.
 */
public final class KeywordIntentExtractor implements IntentExtractor {

    static final double SINGLE_WORD_CONFIDENCE = 0.7;
    static final double UNKNOWN_CONFIDENCE = 0.5;
    static final double PER_MATCH_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 0.8;

    /** Keyword to intent type; insertion order decides ties. */
    private static final Map<String, String> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("help", "help");
        KEYWORDS.put("aide", "help");
        KEYWORDS.put("status", "status");
        KEYWORDS.put("statut", "status");
        KEYWORDS.put("quit", Intent.QUIT);
        KEYWORDS.put("quitte", Intent.QUIT);
        KEYWORDS.put("arrête", Intent.QUIT);
        KEYWORDS.put("stop", Intent.QUIT);
        KEYWORDS.put("time", "time");
        KEYWORDS.put("heure", "time");
        KEYWORDS.put("date", "date");
        KEYWORDS.put("version", "version");
        KEYWORDS.put("capabilities", "capabilities");
        KEYWORDS.put("echo", "echo");
    }

    @Override
    public Intent extractIntent(String text) {
        String raw = text == null ? "" : text.trim();
        List<String> words = TextTokens.tokenize(raw);
        if (words.isEmpty()) {
            return Intent.of(raw, Intent.UNKNOWN, Map.of(), UNKNOWN_CONFIDENCE);
        }
        if (words.size() == 1 && KEYWORDS.containsKey(words.get(0))) {
            String type = KEYWORDS.get(words.get(0));
            return Intent.of(raw, type, Map.of(), SINGLE_WORD_CONFIDENCE);
        }

        Map<String, Integer> matches = new LinkedHashMap<>();
        for (String word : words) {
            String type = KEYWORDS.get(word);
            if (type != null) {
                matches.merge(type, 1, Integer::sum);
            }
        }
        if (matches.isEmpty()) {
            return Intent.of(raw, Intent.UNKNOWN, Map.of(), UNKNOWN_CONFIDENCE);
        }

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : matches.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        double confidence = Math.min(MAX_CONFIDENCE, PER_MATCH_CONFIDENCE * bestCount);
        Map<String, String> params = "echo".equals(best) ? Map.of("text", textAfter(words, "echo")) : Map.of();
        return Intent.of(raw, best, params, confidence);
    }

    private static String textAfter(List<String> words, String keyword) {
        int idx = words.indexOf(keyword);
        return String.join(" ", words.subList(idx + 1, words.size()));
    }
}
