package com.phillippitts.peervoice.service.audio.segment;

import com.phillippitts.peervoice.testutil.AudioFixtures;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnergyVoiceActivityDetectorTest {

    private static final int RATE = AudioFixtures.SAMPLE_RATE;

    @Test
    void shouldDetectVoicedToneAboveThreshold() {
        VoiceActivityDetector vad = new EnergyVoiceActivityDetector(VadAggressiveness.AGGRESSIVE);

        assertThat(vad.isSpeech(AudioFixtures.sine(480, 0.05), RATE)).isTrue();
    }

    @Test
    void shouldRejectQuietFrames() {
        VoiceActivityDetector vad = new EnergyVoiceActivityDetector(VadAggressiveness.AGGRESSIVE);

        assertThat(vad.isSpeech(AudioFixtures.sine(480, 0.005), RATE)).isFalse();
        assertThat(vad.isSpeech(new float[480], RATE)).isFalse();
    }

    @Test
    void shouldRejectLoudBroadbandNoiseAtStrictLevel() {
        VoiceActivityDetector vad = new EnergyVoiceActivityDetector(VadAggressiveness.VERY_AGGRESSIVE);
        float[] noise = new float[480];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = i % 2 == 0 ? 0.2f : -0.2f;
        }

        assertThat(vad.isSpeech(noise, RATE)).isFalse();
    }

    @Test
    void shouldAcceptSoftSpeechOnlyAtLenientLevel() {
        float[] soft = AudioFixtures.sine(480, 0.007);

        assertThat(new EnergyVoiceActivityDetector(VadAggressiveness.QUALITY).isSpeech(soft, RATE)).isTrue();
        assertThat(new EnergyVoiceActivityDetector(VadAggressiveness.VERY_AGGRESSIVE).isSpeech(soft, RATE)).isFalse();
    }

    @Test
    void shouldBeDeterministicForSameFrame() {
        VoiceActivityDetector vad = new EnergyVoiceActivityDetector(VadAggressiveness.LOW_BITRATE);
        Random random = new Random(42);
        float[] frame = new float[480];
        for (int i = 0; i < frame.length; i++) {
            frame[i] = (float) (random.nextGaussian() * 0.02);
        }

        boolean first = vad.isSpeech(frame, RATE);

        assertThat(vad.isSpeech(frame, RATE)).isEqualTo(first);
    }

    @Test
    void shouldNameDetectorAfterLevel() {
        assertThat(new EnergyVoiceActivityDetector(VadAggressiveness.AGGRESSIVE).name())
                .isEqualTo("energy-aggressive");
        assertThatThrownBy(() -> new EnergyVoiceActivityDetector(null))
                .isInstanceOf(NullPointerException.class);
    }
}
