package com.phillippitts.peervoice.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for tokenizing utterances into normalized word tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on anything that is not a letter or digit (regex: [^\p{L}\p{N}]+), so accented
 *       French words such as "arrête" stay whole and "j'annule" yields "j", "annule"</li>
 *   <li>Convert all tokens to lowercase (root locale)</li>
 *   <li>Filter out blank tokens</li>
 * </ul>
 */
public final class TextTokens {

    private TextTokens() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into normalized word tokens.
     *
     * @param text input text to tokenize (may be null or blank)
     * @return immutable list of lowercase tokens in utterance order (empty if none)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            if (!part.isBlank()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Distinct tokens of {@code text}, in first-occurrence order.
     */
    public static Set<String> wordSet(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    /**
     * Intersection-over-union of the word sets of two texts; 0 when either side has no words.
     */
    public static double jaccard(String a, String b) {
        return jaccard(wordSet(a), wordSet(b));
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new LinkedHashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }
}
