package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.config.batching.BatchingProperties;
import com.phillippitts.peervoice.config.interaction.InteractionProperties;
import com.phillippitts.peervoice.domain.CommandResult;
import com.phillippitts.peervoice.domain.Intent;
import com.phillippitts.peervoice.domain.TranscriptionResult;
import com.phillippitts.peervoice.exception.CommandDispatchException;
import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.service.batch.TranscriptionEvent;
import com.phillippitts.peervoice.service.command.CommandDispatcher;
import com.phillippitts.peervoice.service.intent.IntentExtractor;
import com.phillippitts.peervoice.service.metrics.VoiceMetrics;
import com.phillippitts.peervoice.testutil.AudioFixtures;
import com.phillippitts.peervoice.testutil.EventCapturingPublisher;
import com.phillippitts.peervoice.testutil.FakeSpeechRecognizer;
import com.phillippitts.peervoice.testutil.MutableClock;
import com.phillippitts.peervoice.testutil.RecordingSynthesizer;
import com.phillippitts.peervoice.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for InteractionStateMachine turn handling, driven tick by tick with a mocked batcher.
 */
class InteractionStateMachineTest {

    private static final String TIME_QUESTION = "quelle heure est il";

    private InteractionProperties props;
    private SpeechBatcher batcher;
    private Queue<TranscriptionEvent> events;
    private IntentExtractor extractor;
    private CommandDispatcher dispatcher;
    private RecordingSynthesizer synth;
    private MicrophoneGate gate;
    private MutableClock clock;
    private EchoSuppressor echo;
    private PlaybackCoordinator playback;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private InteractionStateMachine sm;
    private long batchIds;

    @BeforeEach
    void setUp() {
        props = new InteractionProperties();
        batcher = mock(SpeechBatcher.class);
        events = new ConcurrentLinkedQueue<>();
        when(batcher.pollEvent(any(Duration.class))).thenAnswer(inv -> Optional.ofNullable(events.poll()));
        when(batcher.popCompletedBatches()).thenReturn(List.of());
        extractor = mock(IntentExtractor.class);
        dispatcher = mock(CommandDispatcher.class);
        synth = new RecordingSynthesizer();
        gate = new MicrophoneGate();
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        echo = new EchoSuppressor(props.getEchoSimilarityThreshold(), Duration.ofMillis(props.getEchoWindowMs()), clock);
        playback = new PlaybackCoordinator(synth, gate, batcher, echo, Duration.ZERO, 0.2, d -> { });
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        sm = new InteractionStateMachine(props, batcher, extractor, dispatcher, playback, echo, gate,
                new ManualActivationTrigger(), new SyncExecutor(), publisher, new VoiceMetrics(registry), clock);
    }

    @AfterEach
    void tearDown() {
        sm.stop();
    }

    private void hear(String text) {
        events.add(new TranscriptionEvent(++batchIds, TranscriptionResult.of(text, 0.9, true, "fake")));
    }

    private void listen() {
        sm.activate();
        sm.tick();
        assertThat(sm.getState()).isEqualTo(InteractionState.LISTENING);
    }

    /** Drives the session into INTENT_VALIDATION with a low-confidence time intent. */
    private void awaitConfirmationFor(Intent intent) {
        when(extractor.extractIntent(intent.rawText())).thenReturn(intent);
        listen();
        hear(intent.rawText());
        sm.tick();
        assertThat(sm.getState()).isEqualTo(InteractionState.INTENT_VALIDATION);
    }

    private long terminatedEvents() {
        return publisher.eventsOfType(InteractionStateChangedEvent.class).stream()
                .filter(e -> e.to() == InteractionState.TERMINATED)
                .count();
    }

    @Test
    void shouldStayIdleUntilActivated() {
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(gate.isOpen()).isFalse();
    }

    @Test
    void shouldOpenGateWhenListening() {
        listen();

        assertThat(gate.isOpen()).isTrue();
        assertThat(publisher.eventsOfType(InteractionStateChangedEvent.class))
                .extracting(InteractionStateChangedEvent::to)
                .containsExactly(InteractionState.LISTENING);
    }

    @Test
    void shouldDispatchHighConfidenceIntentAndAnnounceResult() {
        // Arrange
        when(extractor.extractIntent(TIME_QUESTION)).thenReturn(Intent.of(TIME_QUESTION, "time", Map.of(), 0.9));
        when(dispatcher.dispatch(any())).thenReturn(CommandResult.ok("it is 10:15"));
        listen();

        // Act
        hear(TIME_QUESTION);
        sm.tick();
        sm.tick();

        // Assert
        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo("I checked the clock: it is 10:15");
        assertThat(sm.stats().commandsProcessed()).isEqualTo(1);
        assertThat(sm.intentHistory()).extracting(Intent::type).containsExactly("time");
        assertThat(sm.currentIntent()).isEmpty();
        assertThat(gate.isOpen()).isFalse();
        assertThat(publisher.eventsOfType(InteractionStateChangedEvent.class))
                .extracting(InteractionStateChangedEvent::to)
                .containsExactly(InteractionState.LISTENING, InteractionState.PROCESSING,
                        InteractionState.AWAIT_RESPONSE, InteractionState.IDLE);
        assertThat(registry.find("peervoice.command.dispatched").tag("outcome", "success").counter())
                .isNotNull();
    }

    @Test
    void shouldAskForConfirmationOfLowConfidenceIntentThenDispatchOnYes() {
        // Arrange
        Intent intent = Intent.of(TIME_QUESTION, "time", Map.of(), 0.6);
        when(dispatcher.dispatch(intent)).thenReturn(CommandResult.ok("it is 10:15"));
        awaitConfirmationFor(intent);
        assertThat(synth.lastSpoken()).isEqualTo("You want me to do this: time. Is that right?");
        assertThat(gate.isOpen()).isTrue();
        assertThat(sm.currentIntent()).contains(intent);

        // Act
        hear("oui");
        sm.tick();

        // Assert
        verify(dispatcher).dispatch(intent);
        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo("I checked the clock: it is 10:15");
    }

    @Test
    void shouldCancelOnNegativeConfirmation() {
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));

        hear("non merci");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getCancelled());
        assertThat(sm.currentIntent()).isEmpty();
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldAskToRepeatOnUnclearConfirmation() {
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));

        hear("peut-être demain");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.LISTENING);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getPleaseRepeat());
        assertThat(sm.currentIntent()).isEmpty();
        assertThat(gate.isOpen()).isTrue();
    }

    @Test
    void shouldCancelWhenConfirmationTimesOut() {
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));

        clock.advance(Duration.ofMillis(props.getConfirmationTimeoutMs()));
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getCancelled());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldDiscardEchoOfOwnPrompt() {
        // Arrange
        listen();
        playback.say("Vous avez dit bonjour");
        clock.advance(Duration.ofMillis(800));

        // Act
        hear("vous avez dit bonjour");
        sm.tick();

        // Assert
        assertThat(sm.getState()).isEqualTo(InteractionState.LISTENING);
        assertThat(sm.stats().echoesSuppressed()).isEqualTo(1);
        verify(extractor, never()).extractIntent(anyString());
        assertThat(registry.find("peervoice.echo.suppressed").counter()).isNotNull();
    }

    @Test
    void shouldAcceptSameTextOnceEchoWindowHasPassed() {
        // Arrange
        when(extractor.extractIntent(anyString()))
                .thenAnswer(inv -> Intent.of(inv.getArgument(0), Intent.UNKNOWN, Map.of(), 0.5));
        listen();
        playback.say("Vous avez dit bonjour");
        clock.advance(Duration.ofMillis(props.getEchoWindowMs() + 500));

        // Act
        hear("vous avez dit bonjour");
        sm.tick();

        // Assert
        verify(extractor).extractIntent("vous avez dit bonjour");
        assertThat(sm.stats().echoesSuppressed()).isZero();
    }

    @Test
    void shouldTerminateFromListeningOnStop() {
        listen();

        sm.stop();

        assertThat(sm.getState()).isEqualTo(InteractionState.TERMINATED);
        assertThat(gate.isOpen()).isFalse();
        assertThat(sm.isRunning()).isFalse();
        verify(batcher).forceFinalize();
        verify(batcher, never()).discardActiveBatch();
    }

    @Test
    void shouldTranscribeSpeechInProgressWhenStopped() {
        // Arrange: a real batcher holding 20 segments of speech
        FakeSpeechRecognizer recognizer = new FakeSpeechRecognizer("quelle heure");
        SpeechBatcher realBatcher = new SpeechBatcher(new BatchingProperties(), recognizer, new SyncExecutor(),
                clock, new VoiceMetrics(registry), AudioFixtures.SAMPLE_RATE);
        PlaybackCoordinator realPlayback = new PlaybackCoordinator(synth, gate, realBatcher, echo,
                Duration.ZERO, 0.2, d -> { });
        InteractionStateMachine session = new InteractionStateMachine(props, realBatcher, extractor, dispatcher,
                realPlayback, echo, gate, new ManualActivationTrigger(), new SyncExecutor(), publisher,
                new VoiceMetrics(registry), clock);
        session.activate();
        session.tick();
        Instant t = clock.instant();
        for (int i = 0; i < 20; i++) {
            realBatcher.addSegment(AudioFixtures.speech(AudioFixtures.FRAME_SAMPLES, t));
            t = t.plusMillis(30);
        }
        assertThat(realBatcher.hasActiveBatch()).isTrue();

        // Act
        session.stop();
        realBatcher.stop();

        // Assert
        assertThat(session.getState()).isEqualTo(InteractionState.TERMINATED);
        assertThat(recognizer.finalSampleCounts).containsExactly(20 * AudioFixtures.FRAME_SAMPLES);
        assertThat(realBatcher.statistics().batchesCompleted()).isEqualTo(1);
    }

    @Test
    void shouldAnswerQueriesWhilePromptIsPlaying() throws Exception {
        // Arrange
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));
        CountDownLatch speaking = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        synth.onSpeak = () -> {
            speaking.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        hear("non merci");

        // Act
        CompletableFuture<Void> ticking = CompletableFuture.runAsync(sm::tick);
        assertThat(speaking.await(3, TimeUnit.SECONDS)).isTrue();
        Optional<Intent> duringPlayback = CompletableFuture.supplyAsync(sm::currentIntent).get(1, TimeUnit.SECONDS);
        release.countDown();
        ticking.get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(duringPlayback).isEmpty();
        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getCancelled());
    }

    @Test
    void shouldTerminateFromConfirmationOnStopWithoutDispatching() {
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));

        sm.submitGlobalCommand(GlobalCommand.STOP);

        assertThat(sm.getState()).isEqualTo(InteractionState.TERMINATED);
        assertThat(sm.currentIntent()).isEmpty();
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldPublishSingleTerminationWhenStoppedTwice() {
        listen();

        sm.stop();
        sm.stop();
        sm.tick();

        assertThat(terminatedEvents()).isEqualTo(1);
        assertThatThrownBy(() -> sm.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAnnounceAndTerminateOnSpokenStop() {
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));

        hear("arrête");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.TERMINATED);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getStopping());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldTerminateOnQuitWordAtEndOfSentence() {
        listen();

        hear("merci au revoir");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.TERMINATED);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getStopping());
        verify(extractor, never()).extractIntent(anyString());
    }

    @Test
    void shouldConfirmQuitWordInMiddleOfSentence() {
        // Arrange
        String text = "stop the music and tell me the time";
        when(dispatcher.dispatch(any())).thenReturn(CommandResult.ok("goodbye"));
        listen();
        hear(text);
        sm.tick();
        assertThat(sm.getState()).isEqualTo(InteractionState.INTENT_VALIDATION);
        assertThat(sm.currentIntent().get().type()).isEqualTo(Intent.QUIT);
        assertThat(sm.currentIntent().get().confidence())
                .isEqualTo(InteractionStateMachine.AMBIGUOUS_QUIT_CONFIDENCE);

        // Act
        hear("yes");
        sm.tick();

        // Assert
        assertThat(sm.getState()).isEqualTo(InteractionState.TERMINATED);
        assertThat(synth.lastSpoken()).isEqualTo("Shutting down now.");
        verify(extractor, never()).extractIntent(anyString());
    }

    @Test
    void shouldIgnoreTranscriptionsWhilePausedAndResume() {
        // Arrange
        when(extractor.extractIntent(TIME_QUESTION)).thenReturn(Intent.of(TIME_QUESTION, "time", Map.of(), 0.9));
        when(dispatcher.dispatch(any())).thenReturn(CommandResult.ok("it is 10:15"));
        listen();

        // Act
        hear("pause");
        sm.tick();
        hear(TIME_QUESTION);
        sm.tick();

        // Assert
        assertThat(sm.isPaused()).isTrue();
        assertThat(sm.getState()).isEqualTo(InteractionState.LISTENING);
        assertThat(synth.spoken).contains(props.getPrompts().getPaused());
        verify(extractor, never()).extractIntent(anyString());

        // Act
        hear("resume");
        sm.tick();
        hear(TIME_QUESTION);
        sm.tick();

        // Assert
        assertThat(sm.isPaused()).isFalse();
        assertThat(synth.spoken).contains(props.getPrompts().getResumed());
        verify(extractor).extractIntent(TIME_QUESTION);
    }

    @Test
    void shouldPauseAndResumeViaSubmittedCommands() {
        listen();

        sm.submitGlobalCommand(GlobalCommand.PAUSE);
        sm.tick();
        clock.advance(Duration.ofMillis(props.getMaxListeningMs() + 1));
        sm.tick();

        assertThat(sm.isPaused()).isTrue();
        assertThat(sm.getState()).isEqualTo(InteractionState.LISTENING);

        sm.submitGlobalCommand(GlobalCommand.RESUME);
        sm.tick();

        assertThat(sm.isPaused()).isFalse();
        assertThat(sm.getState()).isEqualTo(InteractionState.PROCESSING);
    }

    @Test
    void shouldCancelTurnOnCancelCommand() {
        awaitConfirmationFor(Intent.of(TIME_QUESTION, "time", Map.of(), 0.6));

        hear("annule");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(sm.currentIntent()).isEmpty();
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getCancelled());
    }

    @Test
    void shouldReturnToIdleAndUnpauseOnRestart() {
        listen();
        sm.submitGlobalCommand(GlobalCommand.PAUSE);
        sm.tick();

        hear("recommence");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(sm.isPaused()).isFalse();
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getRestarted());
    }

    @Test
    void shouldSayNothingUnderstoodOnEmptyFinal() {
        listen();

        events.add(new TranscriptionEvent(1, TranscriptionResult.empty(true, "fake")));
        sm.tick();
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getNothingUnderstood());
    }

    @Test
    void shouldIgnorePartials() {
        listen();

        events.add(new TranscriptionEvent(1, TranscriptionResult.of("quelle heure", 0.9, false, "fake")));
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.LISTENING);
        verify(extractor, never()).extractIntent(anyString());
    }

    @Test
    void shouldForceFinalizeWhenListeningWindowElapses() {
        listen();

        clock.advance(Duration.ofMillis(props.getMaxListeningMs()));
        sm.tick();

        verify(batcher).forceFinalize();
        assertThat(sm.getState()).isEqualTo(InteractionState.PROCESSING);
    }

    @Test
    void shouldTellUserWhenIntentIsUnknown() {
        when(extractor.extractIntent(anyString())).thenReturn(Intent.of("blabla", Intent.UNKNOWN, Map.of(), 0.5));
        listen();

        hear("blabla");
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getIntentNotUnderstood());
    }

    @Test
    void shouldApologizeWhenIntentExtractionFails() {
        when(extractor.extractIntent(anyString())).thenThrow(new IllegalStateException("model crashed"));
        listen();

        hear(TIME_QUESTION);
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getApology());
    }

    @Test
    void shouldApologizeWhenDispatchFails() {
        // Arrange
        when(extractor.extractIntent(TIME_QUESTION)).thenReturn(Intent.of(TIME_QUESTION, "time", Map.of(), 0.9));
        when(dispatcher.dispatch(any())).thenThrow(new CommandDispatchException("backend down", "time"));
        listen();

        // Act
        hear(TIME_QUESTION);
        sm.tick();
        sm.tick();

        // Assert
        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getApology());
        assertThat(registry.find("peervoice.command.dispatched").tag("outcome", "failure").counter())
                .isNotNull();
    }

    @Test
    void shouldApologizeWhenCommandReportsFailure() {
        when(extractor.extractIntent(TIME_QUESTION)).thenReturn(Intent.of(TIME_QUESTION, "time", Map.of(), 0.9));
        when(dispatcher.dispatch(any())).thenReturn(CommandResult.failed("clock unavailable"));
        listen();

        hear(TIME_QUESTION);
        sm.tick();
        sm.tick();

        assertThat(sm.getState()).isEqualTo(InteractionState.IDLE);
        assertThat(synth.lastSpoken()).isEqualTo(props.getPrompts().getApology());
    }

    @Test
    void shouldRunTurnsOnBackgroundLoop() {
        // Arrange
        props.setTickMs(10);

        // Act
        sm.start();
        sm.start();
        sm.activate();

        // Assert
        await().atMost(Duration.ofSeconds(3)).until(() -> sm.getState() == InteractionState.LISTENING);
        assertThat(sm.isRunning()).isTrue();
        assertThat(sm.stats().sessionStart()).isEqualTo(clock.instant());
        sm.stop();
        assertThat(sm.isRunning()).isFalse();
        assertThat(sm.getState()).isEqualTo(InteractionState.TERMINATED);
    }
}
