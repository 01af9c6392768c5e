package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.util.TextTokens;

import java.util.List;
import java.util.Set;

/**
 * Classifies an answer to a confirmation question. A negative word anywhere wins over a
 * positive one ("oui, enfin non").
 */
public final class ConfirmationClassifier {

    public enum Answer { YES, NO, UNKNOWN }

    static final Set<String> YES_WORDS = Set.of(
            "yes", "yeah", "yep", "ok", "okay", "sure",
            "oui", "ouais", "exactement", "confirme", "correct");
    static final Set<String> NO_WORDS = Set.of("no", "nope", "non", "pas");

    private ConfirmationClassifier() {}

    public static Answer classify(String text) {
        List<String> words = TextTokens.tokenize(text);
        boolean yes = false;
        for (String word : words) {
            if (NO_WORDS.contains(word)) {
                return Answer.NO;
            }
            if (YES_WORDS.contains(word)) {
                yes = true;
            }
        }
        return yes ? Answer.YES : Answer.UNKNOWN;
    }
}
