package com.phillippitts.peervoice.config.interaction;

import com.phillippitts.peervoice.config.audio.AudioCaptureProperties;
import com.phillippitts.peervoice.config.audio.SegmentationProperties;
import com.phillippitts.peervoice.config.batching.BatchingProperties;
import com.phillippitts.peervoice.config.recognizer.WhisperProperties;
import com.phillippitts.peervoice.config.synthesis.SynthesizerProperties;
import com.phillippitts.peervoice.service.audio.AudioFormat;
import com.phillippitts.peervoice.service.audio.capture.AudioFrameSource;
import com.phillippitts.peervoice.service.audio.capture.JavaSoundAudioFrameSource;
import com.phillippitts.peervoice.service.audio.segment.EnergyVoiceActivityDetector;
import com.phillippitts.peervoice.service.audio.segment.SegmentClassifier;
import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.service.command.BuiltinCommandDispatcher;
import com.phillippitts.peervoice.service.command.CommandDispatcher;
import com.phillippitts.peervoice.service.intent.IntentExtractor;
import com.phillippitts.peervoice.service.intent.KeywordIntentExtractor;
import com.phillippitts.peervoice.service.interaction.ActivationTrigger;
import com.phillippitts.peervoice.service.interaction.AudioPipeline;
import com.phillippitts.peervoice.service.interaction.ContinuousActivationTrigger;
import com.phillippitts.peervoice.service.interaction.EchoSuppressor;
import com.phillippitts.peervoice.service.interaction.InteractionStateMachine;
import com.phillippitts.peervoice.service.interaction.ManualActivationTrigger;
import com.phillippitts.peervoice.service.interaction.MicrophoneGate;
import com.phillippitts.peervoice.service.interaction.PlaybackCoordinator;
import com.phillippitts.peervoice.service.metrics.VoiceMetrics;
import com.phillippitts.peervoice.service.process.ProcessRunner;
import com.phillippitts.peervoice.service.stt.SpeechRecognizer;
import com.phillippitts.peervoice.service.stt.whisper.WhisperCliSpeechRecognizer;
import com.phillippitts.peervoice.service.tts.CommandLineSpeechSynthesizer;
import com.phillippitts.peervoice.service.tts.LogOnlySpeechSynthesizer;
import com.phillippitts.peervoice.service.tts.SpeechSynthesizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the speech pipeline explicitly: capture, classification, batching, playback and the
 * interaction state machine. Default adapters for the recognizer, synthesizer, intent extractor
 * and command dispatcher back off when the application defines its own bean.
 */
@Configuration
public class InteractionConfig {

    private final InteractionProperties interactionProperties;

    public InteractionConfig(InteractionProperties interactionProperties) {
        this.interactionProperties = interactionProperties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean(SpeechRecognizer.class)
    public SpeechRecognizer whisperSpeechRecognizer(WhisperProperties whisperProperties) {
        WhisperCliSpeechRecognizer recognizer = new WhisperCliSpeechRecognizer(whisperProperties, new ProcessRunner());
        recognizer.initialize();
        return recognizer;
    }

    /**
     * External TTS command. Active unless synthesizer.enabled=false.
     */
    @Bean
    @ConditionalOnProperty(prefix = "synthesizer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SpeechSynthesizer commandLineSpeechSynthesizer(SynthesizerProperties synthesizerProperties) {
        return new CommandLineSpeechSynthesizer(synthesizerProperties, new ProcessRunner());
    }

    /**
     * Log-only synthesizer for headless runs. Active when synthesizer.enabled=false.
     */
    @Bean
    @ConditionalOnProperty(prefix = "synthesizer", name = "enabled", havingValue = "false")
    public SpeechSynthesizer logOnlySpeechSynthesizer(SynthesizerProperties synthesizerProperties) {
        return new LogOnlySpeechSynthesizer(synthesizerProperties);
    }

    @Bean
    @ConditionalOnMissingBean(IntentExtractor.class)
    public IntentExtractor keywordIntentExtractor() {
        return new KeywordIntentExtractor();
    }

    @Bean
    @ConditionalOnMissingBean(CommandDispatcher.class)
    public CommandDispatcher builtinCommandDispatcher(Clock clock,
                                                      @Value("${peervoice.version:0.1.0}") String version) {
        return new BuiltinCommandDispatcher(clock, version);
    }

    @Bean
    public SegmentClassifier segmentClassifier(SegmentationProperties segmentationProperties) {
        return new SegmentClassifier(
                new EnergyVoiceActivityDetector(segmentationProperties.getVadAggressiveness()),
                segmentationProperties.getFallbackEnergyThreshold());
    }

    @Bean
    @ConditionalOnMissingBean(AudioFrameSource.class)
    public AudioFrameSource javaSoundAudioFrameSource(AudioCaptureProperties audioCaptureProperties,
                                                      ApplicationEventPublisher publisher,
                                                      Clock clock) {
        return new JavaSoundAudioFrameSource(audioCaptureProperties, publisher, clock);
    }

    @Bean(destroyMethod = "stop")
    public SpeechBatcher speechBatcher(BatchingProperties batchingProperties,
                                       SpeechRecognizer recognizer,
                                       @Qualifier("transcriptionExecutor") ThreadPoolTaskExecutor transcriptionExecutor,
                                       Clock clock,
                                       VoiceMetrics metrics) {
        return new SpeechBatcher(batchingProperties, recognizer, transcriptionExecutor, clock, metrics,
                AudioFormat.REQUIRED_SAMPLE_RATE);
    }

    @Bean
    public MicrophoneGate microphoneGate() {
        return new MicrophoneGate();
    }

    @Bean
    public EchoSuppressor echoSuppressor(Clock clock) {
        return new EchoSuppressor(interactionProperties.getEchoSimilarityThreshold(),
                Duration.ofMillis(interactionProperties.getEchoWindowMs()), clock);
    }

    @Bean
    public PlaybackCoordinator playbackCoordinator(SpeechSynthesizer synthesizer,
                                                   MicrophoneGate gate,
                                                   SpeechBatcher batcher,
                                                   EchoSuppressor echoSuppressor) {
        return new PlaybackCoordinator(synthesizer, gate, batcher, echoSuppressor,
                Duration.ofMillis(interactionProperties.getPlaybackCooldownMinMs()),
                interactionProperties.getPlaybackCooldownRatio());
    }

    @Bean
    public ActivationTrigger activationTrigger() {
        return interactionProperties.getActivation() == ActivationMode.CONTINUOUS
                ? new ContinuousActivationTrigger()
                : new ManualActivationTrigger();
    }

    @Bean(destroyMethod = "stop")
    public AudioPipeline audioPipeline(AudioFrameSource source,
                                       SegmentClassifier classifier,
                                       SpeechBatcher batcher,
                                       MicrophoneGate gate,
                                       AudioCaptureProperties audioCaptureProperties) {
        return new AudioPipeline(source, classifier, batcher, gate,
                Duration.ofMillis(audioCaptureProperties.getPollTimeoutMs()));
    }

    @Bean
    public InteractionStateMachine interactionStateMachine(SpeechBatcher batcher,
                                                           IntentExtractor intentExtractor,
                                                           CommandDispatcher commandDispatcher,
                                                           PlaybackCoordinator playbackCoordinator,
                                                           EchoSuppressor echoSuppressor,
                                                           MicrophoneGate gate,
                                                           ActivationTrigger activationTrigger,
                                                           @Qualifier("eventExecutor") ThreadPoolTaskExecutor eventExecutor,
                                                           ApplicationEventPublisher publisher,
                                                           VoiceMetrics metrics,
                                                           Clock clock) {
        return new InteractionStateMachine(interactionProperties, batcher, intentExtractor, commandDispatcher,
                playbackCoordinator, echoSuppressor, gate, activationTrigger, eventExecutor, publisher,
                metrics, clock);
    }
}
