package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.util.TextTokens;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes short utterances ({@code maxWords} tokens or fewer) that contain a global command
 * keyword. When several match, declaration order of {@link GlobalCommand} wins.
 */
public final class GlobalCommandDetector {

    private final int maxWords;

    public GlobalCommandDetector(int maxWords) {
        if (maxWords < 1) {
            throw new IllegalArgumentException("maxWords must be >= 1, got: " + maxWords);
        }
        this.maxWords = maxWords;
    }

    public Optional<GlobalCommand> detect(String text) {
        List<String> words = TextTokens.tokenize(text);
        if (words.isEmpty() || words.size() > maxWords) {
            return Optional.empty();
        }
        for (GlobalCommand command : GlobalCommand.values()) {
            for (String word : words) {
                if (command.keywords().contains(word)) {
                    return Optional.of(command);
                }
            }
        }
        return Optional.empty();
    }
}
