package com.phillippitts.peervoice.service.tts;

import com.phillippitts.peervoice.domain.SynthesisResult;

/**
 * Speaks text to the user. Blocks until playback has finished.
 */
public interface SpeechSynthesizer {

    /**
     * @param text text to speak; blank text is a no-op
     * @return playback outcome with the measured or estimated duration
     * @throws com.phillippitts.peervoice.exception.SynthesisException when audio cannot be produced
     */
    SynthesisResult synthesize(String text);

    String name();
}
