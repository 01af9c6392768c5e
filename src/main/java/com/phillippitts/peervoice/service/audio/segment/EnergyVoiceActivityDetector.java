package com.phillippitts.peervoice.service.audio.segment;

import com.phillippitts.peervoice.service.audio.PcmCodec;

import java.util.Objects;

/**
 * Energy and zero-crossing voice activity detector.
 *
 * <p>A frame is speech when its RMS reaches the level's energy threshold and its zero-crossing
 * rate stays below the level's noise ceiling. No hysteresis is applied: smoothing across frames
 * is the batcher's job (pause thresholds), which keeps this detector stateless.
 */
public class EnergyVoiceActivityDetector implements VoiceActivityDetector {

    private final VadAggressiveness level;

    public EnergyVoiceActivityDetector(VadAggressiveness level) {
        this.level = Objects.requireNonNull(level, "level must not be null");
    }

    @Override
    public boolean isSpeech(float[] samples, int sampleRate) {
        double energy = PcmCodec.rms(samples);
        if (energy < level.energyThreshold()) {
            return false;
        }
        return PcmCodec.zeroCrossingRate(samples) <= level.maxZeroCrossingRate();
    }

    @Override
    public String name() {
        return "energy-" + level.name().toLowerCase();
    }

    public VadAggressiveness getLevel() {
        return level;
    }
}
