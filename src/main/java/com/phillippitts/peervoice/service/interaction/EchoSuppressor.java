package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.util.TextTokens;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Detects transcriptions that are the assistant hearing its own voice.
 *
 * <p>During playback and for {@code window} after it, a transcription is an echo when the
 * Jaccard similarity of its word set with the spoken text exceeds {@code similarityThreshold}, or
 * when it contains every spoken word. Texts sharing no word with the spoken one are accepted.
 */
public final class EchoSuppressor {

    private static final Logger LOG = LogManager.getLogger(EchoSuppressor.class);
    static final int MIN_TEXT_LENGTH = 2;

    public enum Verdict { ACCEPT, NOISE, ECHO }

    private final double similarityThreshold;
    private final Duration window;
    private final Clock clock;

    private final Object lock = new Object();
    // Guarded by lock
    private Set<String> spokenWords = Set.of();
    private Instant speakingStartedAt;
    private Instant speakingFinishedAt;
    private boolean speaking;

    public EchoSuppressor(double similarityThreshold, Duration window, Clock clock) {
        this.similarityThreshold = similarityThreshold;
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void markSpeakingStarted(String text) {
        synchronized (lock) {
            spokenWords = TextTokens.wordSet(text);
            speakingStartedAt = clock.instant();
            speakingFinishedAt = null;
            speaking = true;
        }
    }

    public void markSpeakingFinished() {
        synchronized (lock) {
            speakingFinishedAt = clock.instant();
            speaking = false;
        }
    }

    public Verdict evaluate(String transcript) {
        if (transcript == null || transcript.trim().length() < MIN_TEXT_LENGTH) {
            return Verdict.NOISE;
        }
        synchronized (lock) {
            if (speakingStartedAt == null || spokenWords.isEmpty() || !withinWindow()) {
                return Verdict.ACCEPT;
            }
            Set<String> heard = TextTokens.wordSet(transcript);
            double similarity = TextTokens.jaccard(spokenWords, heard);
            if (similarity > similarityThreshold || heard.containsAll(spokenWords)) {
                LOG.debug("Echo detected (similarity={})", String.format("%.2f", similarity));
                return Verdict.ECHO;
            }
            return Verdict.ACCEPT;
        }
    }

    public boolean isSpeaking() {
        synchronized (lock) {
            return speaking;
        }
    }

    private boolean withinWindow() {
        if (speaking) {
            return true;
        }
        return speakingFinishedAt != null
                && !clock.instant().isAfter(speakingFinishedAt.plus(window));
    }
}
