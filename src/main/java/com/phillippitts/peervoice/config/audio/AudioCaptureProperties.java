package com.phillippitts.peervoice.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by the frame source): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Duration of one captured frame in milliseconds. */
    @Min(10)
    @Max(200)
    private final int frameMillis;

    /** Frames buffered between the device thread and the classification loop; oldest dropped when full. */
    @Min(1)
    @Max(10_000)
    private final int queueCapacity;

    /** How long the classification loop waits for a frame before running housekeeping. */
    @Min(10)
    @Max(5_000)
    private final int pollTimeoutMs;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(Integer frameMillis,
                                  Integer queueCapacity,
                                  Integer pollTimeoutMs,
                                  String deviceName) {
        this.frameMillis = frameMillis == null ? 30 : frameMillis;
        this.queueCapacity = queueCapacity == null ? 200 : queueCapacity;
        this.pollTimeoutMs = pollTimeoutMs == null ? 200 : pollTimeoutMs;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getFrameMillis() { return frameMillis; }
    public int getQueueCapacity() { return queueCapacity; }
    public int getPollTimeoutMs() { return pollTimeoutMs; }
    public String getDeviceName() { return deviceName; }
}
