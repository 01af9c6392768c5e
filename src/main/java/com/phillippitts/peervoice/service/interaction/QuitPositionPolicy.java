package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.util.TextTokens;

import java.util.List;
import java.util.Set;

/**
 * Locates the last quit word in an utterance.
 *
 * <p>A quit word whose 0-based index is at least {@code endRatio * (wordCount - 1)} sits at the end
 * of the sentence and ends the session; a lone "quit" counts as the end. Earlier in the sentence it is ambiguous
 * ("stop the music and tell me the time") and must be confirmed.
 */
public final class QuitPositionPolicy {

    public enum Position { END, MIDDLE, NONE }

    static final Set<String> QUIT_WORDS = Set.of("stop", "arrête", "quitte", "quit", "exit", "ferme", "bye");

    private final double endRatio;

    public QuitPositionPolicy(double endRatio) {
        if (endRatio < 0.0 || endRatio > 1.0) {
            throw new IllegalArgumentException("endRatio must be within [0, 1], got: " + endRatio);
        }
        this.endRatio = endRatio;
    }

    public Position classify(String text) {
        List<String> words = TextTokens.tokenize(text);
        int last = -1;
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            if (QUIT_WORDS.contains(word) || ("revoir".equals(word) && i > 0 && "au".equals(words.get(i - 1)))) {
                last = i;
            }
        }
        if (last < 0) {
            return Position.NONE;
        }
        return last >= (words.size() - 1) * endRatio ? Position.END : Position.MIDDLE;
    }
}
