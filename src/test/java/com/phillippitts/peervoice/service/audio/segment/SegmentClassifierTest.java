package com.phillippitts.peervoice.service.audio.segment;

import com.phillippitts.peervoice.domain.AudioFrame;
import com.phillippitts.peervoice.domain.AudioSegment;
import com.phillippitts.peervoice.testutil.AudioFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SegmentClassifierTest {

    private static final Instant AT = Instant.parse("2025-01-01T10:00:00Z");

    private SegmentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new SegmentClassifier(new EnergyVoiceActivityDetector(VadAggressiveness.AGGRESSIVE), 0.01);
    }

    @Test
    void shouldReturnSilentSegmentForNullFrame() {
        AudioSegment segment = classifier.classify(null);

        assertThat(segment.hasSpeech()).isFalse();
        assertThat(segment.energyLevel()).isZero();
        assertThat(segment.sampleCount()).isZero();
    }

    @Test
    void shouldReturnSilentSegmentForEmptyFrame() {
        AudioSegment segment = classifier.classify(new AudioFrame(new short[0], 16_000, AT));

        assertThat(segment.hasSpeech()).isFalse();
        assertThat(segment.energyLevel()).isZero();
        assertThat(segment.timestamp()).isEqualTo(AT);
        assertThat(segment.duration()).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldClassifyToneAsSpeechWithEnergyAndDuration() {
        // Arrange
        AudioFrame frame = AudioFixtures.sineFrame(AudioFixtures.FRAME_SAMPLES, 0.05, AT);

        // Act
        AudioSegment segment = classifier.classify(frame);

        // Assert
        assertThat(segment.hasSpeech()).isTrue();
        assertThat(segment.energyLevel()).isCloseTo(0.05, within(1e-3));
        assertThat(segment.duration()).isEqualTo(Duration.ofMillis(30));
        assertThat(segment.timestamp()).isEqualTo(AT);
        assertThat(segment.samples()).hasSize(AudioFixtures.FRAME_SAMPLES);
    }

    @Test
    void shouldClassifyZeroFrameAsSilence() {
        AudioSegment segment = classifier.classify(AudioFixtures.silentFrame(AudioFixtures.FRAME_SAMPLES, AT));

        assertThat(segment.hasSpeech()).isFalse();
        assertThat(segment.energyLevel()).isZero();
    }

    @Test
    void shouldFallBackToEnergyThresholdWhenDetectorFails() {
        // Arrange
        VoiceActivityDetector broken = new VoiceActivityDetector() {
            @Override
            public boolean isSpeech(float[] samples, int sampleRate) {
                throw new IllegalStateException("model not loaded");
            }

            @Override
            public String name() {
                return "broken";
            }
        };
        SegmentClassifier withBroken = new SegmentClassifier(broken, 0.01);

        // Act
        AudioSegment loud = withBroken.classify(AudioFixtures.sineFrame(480, 0.05, AT));
        AudioSegment quiet = withBroken.classify(AudioFixtures.sineFrame(480, 0.002, AT));

        // Assert
        assertThat(loud.hasSpeech()).isTrue();
        assertThat(quiet.hasSpeech()).isFalse();
        assertThat(withBroken.detectorName()).isEqualTo("broken");
    }

    @Test
    void shouldBlendVerdictAndEnergyIntoProbability() {
        AudioSegment speech = AudioSegment.of(new float[480], 16_000, AT, true, 0.05);
        AudioSegment loudSilence = AudioSegment.of(new float[480], 16_000, AT, false, 0.5);

        assertThat(SegmentClassifier.speechProbability(speech)).isCloseTo(0.9, within(1e-9));
        assertThat(SegmentClassifier.speechProbability(loudSilence)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void shouldRejectOutOfRangeFallbackThreshold() {
        assertThatThrownBy(() -> new SegmentClassifier(new EnergyVoiceActivityDetector(VadAggressiveness.QUALITY), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
