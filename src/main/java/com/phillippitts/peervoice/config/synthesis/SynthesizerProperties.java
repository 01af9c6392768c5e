package com.phillippitts.peervoice.config.synthesis;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Text-to-speech settings. When {@code synthesizer.enabled=false} prompts are only logged.
 *
 * <pre>
 * synthesizer.command=espeak-ng,-v,fr
 * </pre>
 * The text to speak is appended as the last argument.
 */
@Validated
@ConfigurationProperties(prefix = "synthesizer")
public class SynthesizerProperties {

    private boolean enabled = true;

    @NotEmpty
    private List<String> command = new ArrayList<>(List.of("espeak-ng"));

    @Min(1)
    private int timeoutSeconds = 30;

    /** Speaking rate used to estimate playback duration. */
    @DecimalMin("1.0")
    private double charsPerSecond = 15.0;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public double getCharsPerSecond() { return charsPerSecond; }
    public void setCharsPerSecond(double charsPerSecond) { this.charsPerSecond = charsPerSecond; }
}
