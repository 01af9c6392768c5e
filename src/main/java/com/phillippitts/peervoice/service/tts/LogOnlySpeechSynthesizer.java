package com.phillippitts.peervoice.service.tts;

import com.phillippitts.peervoice.config.synthesis.SynthesizerProperties;
import com.phillippitts.peervoice.domain.SynthesisResult;
import com.phillippitts.peervoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Log-only synthesizer used when audio output is disabled (headless runs, tests). */
public final class LogOnlySpeechSynthesizer implements SpeechSynthesizer {
    private static final Logger LOG = LogManager.getLogger(LogOnlySpeechSynthesizer.class);

    private final double charsPerSecond;

    public LogOnlySpeechSynthesizer(SynthesizerProperties props) {
        this.charsPerSecond = props.getCharsPerSecond();
    }

    @Override
    public SynthesisResult synthesize(String text) {
        LOG.info("Assistant says (chars={})", text == null ? 0 : text.length());
        LOG.debug("Text: '{}'", LogSanitizer.truncate(text, 120));
        return new SynthesisResult(true, CommandLineSpeechSynthesizer.estimateDuration(text, charsPerSecond));
    }

    @Override
    public String name() {
        return "log-only";
    }
}
