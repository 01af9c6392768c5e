package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.domain.SynthesisResult;
import com.phillippitts.peervoice.exception.SynthesisException;
import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.service.tts.SpeechSynthesizer;
import com.phillippitts.peervoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Speaks prompts while keeping the assistant from hearing itself.
 *
 * <p>For each utterance: suspend the microphone gate, drop the batch in progress, record the text
 * with the {@link EchoSuppressor}, synthesize, then keep the gate suspended for a cooldown of
 * {@code max(cooldownMin, audioDuration * cooldownRatio)} before restoring it.
 */
public class PlaybackCoordinator {

    private static final Logger LOG = LogManager.getLogger(PlaybackCoordinator.class);

    /** Blocking pause; replaced in tests. */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final SpeechSynthesizer synthesizer;
    private final MicrophoneGate gate;
    private final SpeechBatcher batcher;
    private final EchoSuppressor echoSuppressor;
    private final Duration cooldownMin;
    private final double cooldownRatio;
    private final Sleeper sleeper;

    public PlaybackCoordinator(SpeechSynthesizer synthesizer, MicrophoneGate gate, SpeechBatcher batcher,
                               EchoSuppressor echoSuppressor, Duration cooldownMin, double cooldownRatio) {
        this(synthesizer, gate, batcher, echoSuppressor, cooldownMin, cooldownRatio,
                d -> Thread.sleep(d.toMillis()));
    }

    PlaybackCoordinator(SpeechSynthesizer synthesizer, MicrophoneGate gate, SpeechBatcher batcher,
                        EchoSuppressor echoSuppressor, Duration cooldownMin, double cooldownRatio,
                        Sleeper sleeper) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.batcher = Objects.requireNonNull(batcher, "batcher must not be null");
        this.echoSuppressor = Objects.requireNonNull(echoSuppressor, "echoSuppressor must not be null");
        this.cooldownMin = Objects.requireNonNull(cooldownMin, "cooldownMin must not be null");
        this.cooldownRatio = cooldownRatio;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Speaks {@code text} and blocks until playback and cooldown are over.
     *
     * @return the synthesis outcome; unsuccessful when the synthesizer failed
     */
    public SynthesisResult say(String text) {
        if (text == null || text.isBlank()) {
            return new SynthesisResult(true, Duration.ZERO);
        }
        MicrophoneGate.Mode previous = gate.suspendForPlayback();
        batcher.discardActiveBatch();
        echoSuppressor.markSpeakingStarted(text);
        SynthesisResult result;
        try {
            LOG.info("Speaking via {}: '{}'", synthesizer.name(), LogSanitizer.preview(text));
            result = synthesizer.synthesize(text);
        } catch (SynthesisException e) {
            LOG.warn("Speech synthesis failed: {}", e.toString());
            result = new SynthesisResult(false, Duration.ZERO);
        } finally {
            echoSuppressor.markSpeakingFinished();
        }
        try {
            sleeper.sleep(cooldown(result.audioDuration()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            gate.restoreAfterPlayback(previous);
        }
        return result;
    }

    Duration cooldown(Duration audioDuration) {
        Duration scaled = Duration.ofMillis(Math.round(audioDuration.toMillis() * cooldownRatio));
        return scaled.compareTo(cooldownMin) > 0 ? scaled : cooldownMin;
    }
}
