package com.phillippitts.peervoice.config.audio;

import com.phillippitts.peervoice.service.audio.segment.VadAggressiveness;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Voice activity settings for the segment classifier.
 *
 * <pre>
 * segmentation.vad-aggressiveness=aggressive
 * segmentation.fallback-energy-threshold=0.01
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "segmentation")
public class SegmentationProperties {

    @NotNull
    private VadAggressiveness vadAggressiveness = VadAggressiveness.AGGRESSIVE;

    /** RMS level above which a frame counts as speech when the detector itself fails. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double fallbackEnergyThreshold = 0.01;

    public VadAggressiveness getVadAggressiveness() {
        return vadAggressiveness;
    }

    public void setVadAggressiveness(VadAggressiveness vadAggressiveness) {
        this.vadAggressiveness = vadAggressiveness;
    }

    public double getFallbackEnergyThreshold() {
        return fallbackEnergyThreshold;
    }

    public void setFallbackEnergyThreshold(double fallbackEnergyThreshold) {
        this.fallbackEnergyThreshold = fallbackEnergyThreshold;
    }
}
