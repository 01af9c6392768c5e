package com.phillippitts.peervoice.service.audio.segment;

/**
 * Ordered sensitivity levels of voice activity detection.
 *
 * <p>Higher levels demand more energy (and a more speech-like zero-crossing rate) before a frame
 * counts as speech: fewer false positives from background noise, more missed soft speech.
 */
public enum VadAggressiveness {
    QUALITY(0.005, 1.0),
    LOW_BITRATE(0.008, 0.6),
    AGGRESSIVE(0.012, 0.5),
    VERY_AGGRESSIVE(0.02, 0.4);

    private final double energyThreshold;
    private final double maxZeroCrossingRate;

    VadAggressiveness(double energyThreshold, double maxZeroCrossingRate) {
        this.energyThreshold = energyThreshold;
        this.maxZeroCrossingRate = maxZeroCrossingRate;
    }

    /** Minimum RMS (normalised samples) for a speech verdict. */
    public double energyThreshold() {
        return energyThreshold;
    }

    /** Frames crossing zero more often than this look like broadband noise, not voice. */
    public double maxZeroCrossingRate() {
        return maxZeroCrossingRate;
    }
}
