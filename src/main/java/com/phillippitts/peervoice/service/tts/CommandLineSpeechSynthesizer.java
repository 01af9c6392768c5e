package com.phillippitts.peervoice.service.tts;

import com.phillippitts.peervoice.config.synthesis.SynthesizerProperties;
import com.phillippitts.peervoice.domain.SynthesisResult;
import com.phillippitts.peervoice.exception.ProcessExecutionException;
import com.phillippitts.peervoice.exception.SynthesisException;
import com.phillippitts.peervoice.service.process.ProcessRunner;
import com.phillippitts.peervoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Speaks through an external TTS program ({@code espeak-ng}, {@code say}, ...).
 * The text is passed as the last argument of the configured command.
 */
public final class CommandLineSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(CommandLineSpeechSynthesizer.class);
    private static final int MAX_STDOUT_BYTES = 64 * 1024;

    private final SynthesizerProperties props;
    private final ProcessRunner runner;

    public CommandLineSpeechSynthesizer(SynthesizerProperties props, ProcessRunner runner) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public SynthesisResult synthesize(String text) {
        if (text == null || text.isBlank()) {
            return new SynthesisResult(true, Duration.ZERO);
        }
        List<String> command = new ArrayList<>(props.getCommand());
        command.add(text);
        try {
            runner.run(command, null, Duration.ofSeconds(props.getTimeoutSeconds()), MAX_STDOUT_BYTES);
        } catch (ProcessExecutionException e) {
            throw new SynthesisException("TTS command failed: " + e.getMessage(), e);
        }
        LOG.debug("Spoke '{}'", LogSanitizer.preview(text));
        return new SynthesisResult(true, estimateDuration(text, props.getCharsPerSecond()));
    }

    /**
     * Playback time estimated from the text length.
     */
    public static Duration estimateDuration(String text, double charsPerSecond) {
        if (text == null || text.isEmpty()) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.round(text.length() / charsPerSecond * 1000.0));
    }

    @Override
    public String name() {
        return "command:" + props.getCommand().get(0);
    }
}
