package com.phillippitts.peervoice.service.audio.segment;

import com.phillippitts.peervoice.domain.AudioFrame;
import com.phillippitts.peervoice.domain.AudioSegment;
import com.phillippitts.peervoice.service.audio.AudioFormat;
import com.phillippitts.peervoice.service.audio.PcmCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Objects;

/**
 * Turns captured frames into classified {@link AudioSegment}s.
 *
 * <p>Never blocks and never throws: a null or empty frame yields a silent segment with energy 0,
 * and a failing detector is replaced for that frame by a plain energy threshold.
 */
public class SegmentClassifier {

    private static final Logger LOG = LogManager.getLogger(SegmentClassifier.class);

    /** Energy at which the speech probability saturates. */
    private static final double PROBABILITY_ENERGY_SCALE = 0.1;

    private final VoiceActivityDetector detector;
    private final double fallbackEnergyThreshold;

    public SegmentClassifier(VoiceActivityDetector detector, double fallbackEnergyThreshold) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        if (fallbackEnergyThreshold < 0.0 || fallbackEnergyThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "fallbackEnergyThreshold must be in [0, 1], got: " + fallbackEnergyThreshold);
        }
        this.fallbackEnergyThreshold = fallbackEnergyThreshold;
    }

    /**
     * Classifies one frame.
     *
     * @param frame captured frame (may be null)
     * @return classified segment, never null
     */
    public AudioSegment classify(AudioFrame frame) {
        if (frame == null) {
            return AudioSegment.silent(AudioFormat.REQUIRED_SAMPLE_RATE, Instant.now());
        }
        if (frame.isEmpty()) {
            return AudioSegment.silent(frame.sampleRate(), frame.capturedAt());
        }
        float[] samples = PcmCodec.toFloats(frame.samples());
        double energy = PcmCodec.rms(samples);
        boolean speech = detectSpeech(samples, frame.sampleRate(), energy);
        AudioSegment segment = AudioSegment.of(samples, frame.sampleRate(), frame.capturedAt(), speech, energy);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Classified frame: speech={}, energy={}, probability={}",
                    speech, String.format("%.4f", energy), String.format("%.2f", speechProbability(segment)));
        }
        return segment;
    }

    /**
     * Blend of the binary verdict and the normalised energy: {@code 0.8 * vad + 0.2 * min(1, energy / 0.1)}.
     */
    public static double speechProbability(AudioSegment segment) {
        double vad = segment.hasSpeech() ? 1.0 : 0.0;
        double energyScore = Math.min(1.0, segment.energyLevel() / PROBABILITY_ENERGY_SCALE);
        return 0.8 * vad + 0.2 * energyScore;
    }

    public String detectorName() {
        return detector.name();
    }

    private boolean detectSpeech(float[] samples, int sampleRate, double energy) {
        try {
            return detector.isSpeech(samples, sampleRate);
        } catch (RuntimeException e) {
            LOG.warn("Voice activity detector '{}' failed, using energy threshold: {}",
                    detector.name(), e.toString());
            return energy > fallbackEnergyThreshold;
        }
    }
}
