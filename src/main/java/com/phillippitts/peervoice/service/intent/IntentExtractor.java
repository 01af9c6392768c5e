package com.phillippitts.peervoice.service.intent;

import com.phillippitts.peervoice.domain.Intent;

/**
 * Turns an utterance into an {@link Intent}.
 */
public interface IntentExtractor {

    /**
     * @param text non-blank utterance
     * @return the extracted intent; type {@link Intent#UNKNOWN} when nothing matched
     * @throws com.phillippitts.peervoice.exception.IntentExtractionException on classifier failure
     */
    Intent extractIntent(String text);
}
