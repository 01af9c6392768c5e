package com.phillippitts.peervoice.config.interaction;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Timing, thresholds and spoken prompts of the interaction state machine.
 */
@Validated
@ConfigurationProperties(prefix = "interaction")
public class InteractionProperties {

    /** Start the session loop when the application is ready. */
    private boolean autoStart = true;

    @NotNull
    private ActivationMode activation = ActivationMode.MANUAL;

    @Min(5)
    private long tickMs = 50;

    /** Listening is force-finalized after this long. */
    @Min(1_000)
    private long maxListeningMs = 30_000;

    /** How long Processing waits for outstanding final transcriptions. */
    @Min(0)
    private long finalWaitMs = 5_000;

    @Min(1_000)
    private long confirmationTimeoutMs = 15_000;

    @Min(100)
    private long dispatchTimeoutMs = 10_000;

    /** Intents at or above this confidence are dispatched without confirmation. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double highConfidenceThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double echoSimilarityThreshold = 0.5;

    @Min(0)
    private long echoWindowMs = 1_000;

    /** Capture stays suspended at least this long after playback ends. */
    @Min(0)
    private long playbackCooldownMinMs = 500;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double playbackCooldownRatio = 0.2;

    /** A quit word at or after this relative position ends the session without confirmation. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double quitEndRatio = 0.8;

    /** Utterances with at most this many words are checked against the global command vocabulary. */
    @Min(1)
    private int globalCommandMaxWords = 3;

    @Min(1)
    private int intentHistorySize = 20;

    @Valid
    private Prompts prompts = new Prompts();

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public ActivationMode getActivation() { return activation; }
    public void setActivation(ActivationMode activation) { this.activation = activation; }

    public long getTickMs() { return tickMs; }
    public void setTickMs(long tickMs) { this.tickMs = tickMs; }

    public long getMaxListeningMs() { return maxListeningMs; }
    public void setMaxListeningMs(long maxListeningMs) { this.maxListeningMs = maxListeningMs; }

    public long getFinalWaitMs() { return finalWaitMs; }
    public void setFinalWaitMs(long finalWaitMs) { this.finalWaitMs = finalWaitMs; }

    public long getConfirmationTimeoutMs() { return confirmationTimeoutMs; }
    public void setConfirmationTimeoutMs(long confirmationTimeoutMs) { this.confirmationTimeoutMs = confirmationTimeoutMs; }

    public long getDispatchTimeoutMs() { return dispatchTimeoutMs; }
    public void setDispatchTimeoutMs(long dispatchTimeoutMs) { this.dispatchTimeoutMs = dispatchTimeoutMs; }

    public double getHighConfidenceThreshold() { return highConfidenceThreshold; }
    public void setHighConfidenceThreshold(double v) { this.highConfidenceThreshold = v; }

    public double getEchoSimilarityThreshold() { return echoSimilarityThreshold; }
    public void setEchoSimilarityThreshold(double v) { this.echoSimilarityThreshold = v; }

    public long getEchoWindowMs() { return echoWindowMs; }
    public void setEchoWindowMs(long echoWindowMs) { this.echoWindowMs = echoWindowMs; }

    public long getPlaybackCooldownMinMs() { return playbackCooldownMinMs; }
    public void setPlaybackCooldownMinMs(long v) { this.playbackCooldownMinMs = v; }

    public double getPlaybackCooldownRatio() { return playbackCooldownRatio; }
    public void setPlaybackCooldownRatio(double v) { this.playbackCooldownRatio = v; }

    public double getQuitEndRatio() { return quitEndRatio; }
    public void setQuitEndRatio(double quitEndRatio) { this.quitEndRatio = quitEndRatio; }

    public int getGlobalCommandMaxWords() { return globalCommandMaxWords; }
    public void setGlobalCommandMaxWords(int v) { this.globalCommandMaxWords = v; }

    public int getIntentHistorySize() { return intentHistorySize; }
    public void setIntentHistorySize(int intentHistorySize) { this.intentHistorySize = intentHistorySize; }

    public Prompts getPrompts() { return prompts; }
    public void setPrompts(Prompts prompts) { this.prompts = prompts; }

    /**
     * Sentences spoken by the assistant. {@code confirm-intent} takes the intent summary as {@code %s}.
     */
    public static class Prompts {
        @NotBlank
        private String nothingUnderstood = "Sorry, I did not understand what you said.";
        @NotBlank
        private String intentNotUnderstood = "Sorry, I did not understand what you want me to do.";
        @NotBlank
        private String confirmIntent = "You want me to do this: %s. Is that right?";
        @NotBlank
        private String pleaseRepeat = "I did not catch that, can you repeat?";
        @NotBlank
        private String cancelled = "Okay, I cancelled the request.";
        @NotBlank
        private String apology = "Sorry, something went wrong while handling your request.";
        @NotBlank
        private String stopping = "Okay, stopping.";
        @NotBlank
        private String paused = "Paused. Say resume to continue.";
        @NotBlank
        private String resumed = "Resuming.";
        @NotBlank
        private String restarted = "Restarting the voice interface.";

        public String getNothingUnderstood() { return nothingUnderstood; }
        public void setNothingUnderstood(String v) { this.nothingUnderstood = v; }

        public String getIntentNotUnderstood() { return intentNotUnderstood; }
        public void setIntentNotUnderstood(String v) { this.intentNotUnderstood = v; }

        public String getConfirmIntent() { return confirmIntent; }
        public void setConfirmIntent(String v) { this.confirmIntent = v; }

        public String getPleaseRepeat() { return pleaseRepeat; }
        public void setPleaseRepeat(String v) { this.pleaseRepeat = v; }

        public String getCancelled() { return cancelled; }
        public void setCancelled(String v) { this.cancelled = v; }

        public String getApology() { return apology; }
        public void setApology(String v) { this.apology = v; }

        public String getStopping() { return stopping; }
        public void setStopping(String v) { this.stopping = v; }

        public String getPaused() { return paused; }
        public void setPaused(String v) { this.paused = v; }

        public String getResumed() { return resumed; }
        public void setResumed(String v) { this.resumed = v; }

        public String getRestarted() { return restarted; }
        public void setRestarted(String v) { this.restarted = v; }
    }
}
