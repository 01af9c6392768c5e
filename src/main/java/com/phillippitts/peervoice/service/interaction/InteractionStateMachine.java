package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.config.interaction.InteractionProperties;
import com.phillippitts.peervoice.domain.CommandResult;
import com.phillippitts.peervoice.domain.Intent;
import com.phillippitts.peervoice.service.batch.SpeechBatch;
import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.service.batch.TranscriptionEvent;
import com.phillippitts.peervoice.service.command.CommandDispatcher;
import com.phillippitts.peervoice.service.intent.IntentExtractor;
import com.phillippitts.peervoice.service.metrics.VoiceMetrics;
import com.phillippitts.peervoice.util.LogSanitizer;
import com.phillippitts.peervoice.util.ProcessTimeouts;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Top-level orchestrator of a voice session.
 *
 * <p>A daemon loop calls {@link #tick()} every {@code tickMs}. Each tick applies queued global
 * commands, consumes transcription events from the {@link SpeechBatcher}, then runs the handler of
 * the current {@link InteractionState}. All state, including {@code currentIntent}, is guarded by a
 * single intent lock; the microphone gate is written only here and by the
 * {@link PlaybackCoordinator}.
 *
 * <p><b>Event handling order:</b> empty finals, echo suppression, global commands, then the
 * state-specific handling. While paused only global commands are honoured.
 *
 * <p><b>Prompts:</b> handlers queue prompts while holding the intent lock; they are spoken in order
 * once the lock is released, so a REST {@link #stop()} or {@link #currentIntent()} never waits for
 * synthesis and cooldown. A tick can still hold the lock for up to {@code finalWaitMs} while it
 * waits for outstanding finals.
 *
 * <p><b>Thread Safety:</b> public methods may be called from any thread. {@link #stop()} is
 * idempotent and also runs on application shutdown. Stopping flushes the batch in progress to the
 * recognizer instead of dropping it.
 */
public class InteractionStateMachine {

    private static final Logger LOG = LogManager.getLogger(InteractionStateMachine.class);

    /** Confidence assigned to a quit word found mid-sentence. */
    static final double AMBIGUOUS_QUIT_CONFIDENCE = 0.5;
    private static final Duration FINAL_WAIT_POLL = Duration.ofMillis(50);

    private final InteractionProperties props;
    private final SpeechBatcher batcher;
    private final IntentExtractor intentExtractor;
    private final CommandDispatcher commandDispatcher;
    private final PlaybackCoordinator playback;
    private final EchoSuppressor echoSuppressor;
    private final MicrophoneGate gate;
    private final ActivationTrigger trigger;
    private final Executor eventExecutor;
    private final ApplicationEventPublisher publisher;
    private final VoiceMetrics metrics;
    private final Clock clock;
    private final GlobalCommandDetector commandDetector;
    private final QuitPositionPolicy quitPolicy;
    private final String sessionId = UUID.randomUUID().toString().substring(0, 8);

    private final Lock intentLock = new ReentrantLock();
    // Guarded by intentLock
    private volatile InteractionState state = InteractionState.IDLE;
    private Intent currentIntent;
    private final List<String> fragments = new ArrayList<>();
    private Instant stateEnteredAt;
    private CompletableFuture<CommandResult> pendingDispatch;
    private final Deque<Intent> intentHistory = new ArrayDeque<>();
    private final List<String> queuedPrompts = new ArrayList<>();

    private final Queue<GlobalCommand> pendingCommands = new ConcurrentLinkedQueue<>();
    private volatile boolean paused;

    private final AtomicLong segmentsProcessed = new AtomicLong();
    private final AtomicLong batchesCompleted = new AtomicLong();
    private final AtomicLong commandsProcessed = new AtomicLong();
    private final AtomicLong echoesSuppressed = new AtomicLong();
    private volatile Instant sessionStart;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Thread loopThread;

    public InteractionStateMachine(InteractionProperties props,
                                   SpeechBatcher batcher,
                                   IntentExtractor intentExtractor,
                                   CommandDispatcher commandDispatcher,
                                   PlaybackCoordinator playback,
                                   EchoSuppressor echoSuppressor,
                                   MicrophoneGate gate,
                                   ActivationTrigger trigger,
                                   Executor eventExecutor,
                                   ApplicationEventPublisher publisher,
                                   VoiceMetrics metrics,
                                   Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.batcher = Objects.requireNonNull(batcher, "batcher must not be null");
        this.intentExtractor = Objects.requireNonNull(intentExtractor, "intentExtractor must not be null");
        this.commandDispatcher = Objects.requireNonNull(commandDispatcher, "commandDispatcher must not be null");
        this.playback = Objects.requireNonNull(playback, "playback must not be null");
        this.echoSuppressor = Objects.requireNonNull(echoSuppressor, "echoSuppressor must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.commandDetector = new GlobalCommandDetector(props.getGlobalCommandMaxWords());
        this.quitPolicy = new QuitPositionPolicy(props.getQuitEndRatio());
        this.stateEnteredAt = clock.instant();
    }

    /**
     * Starts the turn loop. Idempotent; a stopped session cannot be restarted.
     */
    public void start() {
        if (stopRequested.get()) {
            throw new IllegalStateException("Interaction session " + sessionId + " has been stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        sessionStart = clock.instant();
        Thread t = new Thread(this::runLoop, "interaction-loop");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        LOG.info("Interaction session {} started (activation={}, tick={}ms)",
                sessionId, props.getActivation(), props.getTickMs());
    }

    /**
     * Terminates the session from any state, bypassing confirmation. Idempotent.
     */
    @PreDestroy
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        intentLock.lock();
        try {
            terminate(false);
        } finally {
            intentLock.unlock();
        }
        speakQueuedPrompts();
        running.set(false);
        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(ProcessTimeouts.LOOP_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        loopThread = null;
    }

    /**
     * Manual activation request (REST or programmatic).
     */
    public void activate() {
        trigger.requestActivation();
    }

    /**
     * Queues a global command for the next tick. {@link GlobalCommand#STOP} takes effect at once.
     */
    public void submitGlobalCommand(GlobalCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        if (command == GlobalCommand.STOP) {
            stop();
            return;
        }
        pendingCommands.add(command);
    }

    private void runLoop() {
        ThreadContext.put("sessionId", sessionId);
        try {
            while (running.get()) {
                try {
                    tick();
                } catch (RuntimeException e) {
                    LOG.error("Interaction loop error in state {}: {}", state, e.toString(), e);
                }
                try {
                    Thread.sleep(props.getTickMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * One iteration of the turn loop. Package-private for tests.
     */
    void tick() {
        intentLock.lock();
        try {
            advance();
        } finally {
            intentLock.unlock();
        }
        speakQueuedPrompts();
    }

    /** Caller holds intentLock. */
    private void advance() {
        if (state == InteractionState.TERMINATED) {
            return;
        }
        GlobalCommand command;
        while ((command = pendingCommands.poll()) != null) {
            applyGlobalCommand(command);
            if (state == InteractionState.TERMINATED) {
                return;
            }
        }
        collectCompletedBatches();
        Optional<TranscriptionEvent> event;
        while (state != InteractionState.TERMINATED
                && (event = batcher.pollEvent(Duration.ZERO)).isPresent()) {
            handleEvent(event.get());
        }
        if (state == InteractionState.TERMINATED || paused) {
            return;
        }
        switch (state) {
            case IDLE -> onIdle();
            case LISTENING -> onListening();
            case PROCESSING -> onProcessing();
            case INTENT_VALIDATION -> onIntentValidation();
            case AWAIT_RESPONSE -> onAwaitResponse();
            default -> { }
        }
    }

    private void collectCompletedBatches() {
        for (SpeechBatch batch : batcher.popCompletedBatches()) {
            batchesCompleted.incrementAndGet();
            segmentsProcessed.addAndGet(batch.segmentCount());
        }
    }

    private void handleEvent(TranscriptionEvent event) {
        if (!event.isFinal()) {
            LOG.debug("Partial for batch {}: '{}'", event.batchId(), LogSanitizer.preview(event.text()));
            return;
        }
        String text = event.text().trim();
        if (text.isEmpty()) {
            if (!paused && state == InteractionState.LISTENING) {
                LOG.debug("Empty final for batch {}", event.batchId());
                transition(InteractionState.PROCESSING);
            }
            return;
        }
        EchoSuppressor.Verdict verdict = echoSuppressor.evaluate(text);
        if (verdict == EchoSuppressor.Verdict.NOISE) {
            return;
        }
        if (verdict == EchoSuppressor.Verdict.ECHO) {
            echoesSuppressed.incrementAndGet();
            metrics.incrementEchoSuppressed();
            LOG.info("Discarded probable echo for batch {}", event.batchId());
            return;
        }
        Optional<GlobalCommand> command = commandDetector.detect(text);
        if (command.isPresent()) {
            applyGlobalCommand(command.get());
            return;
        }
        if (paused) {
            LOG.debug("Paused; ignoring transcription for batch {}", event.batchId());
            return;
        }
        switch (state) {
            case LISTENING -> {
                fragments.add(text);
                transition(InteractionState.PROCESSING);
            }
            case PROCESSING -> fragments.add(text);
            case INTENT_VALIDATION -> handleConfirmation(text);
            default -> LOG.debug("Ignoring transcription in state {}", state);
        }
    }

    private void onIdle() {
        if (trigger.shouldActivate()) {
            fragments.clear();
            gate.activate();
            transition(InteractionState.LISTENING);
        }
    }

    private void onListening() {
        if (elapsedInState().toMillis() >= props.getMaxListeningMs()) {
            LOG.info("Listening window of {} ms elapsed", props.getMaxListeningMs());
            batcher.forceFinalize();
            transition(InteractionState.PROCESSING);
        }
    }

    private void onProcessing() {
        gate.deactivate();
        awaitOutstandingFinals();
        if (state != InteractionState.PROCESSING) {
            return;
        }
        String text = String.join(" ", fragments).trim();
        fragments.clear();
        if (text.isEmpty()) {
            say(props.getPrompts().getNothingUnderstood());
            transition(InteractionState.IDLE);
            return;
        }

        QuitPositionPolicy.Position quitPosition = quitPolicy.classify(text);
        if (quitPosition == QuitPositionPolicy.Position.END) {
            LOG.info("End-of-sentence quit request; terminating session");
            terminate(true);
            return;
        }

        Intent intent;
        if (quitPosition == QuitPositionPolicy.Position.MIDDLE) {
            intent = Intent.of(text, Intent.QUIT, Map.of(), AMBIGUOUS_QUIT_CONFIDENCE);
        } else {
            try {
                intent = intentExtractor.extractIntent(text);
            } catch (RuntimeException e) {
                LOG.warn("Intent extraction failed: {}", e.toString());
                say(props.getPrompts().getApology());
                transition(InteractionState.IDLE);
                return;
            }
        }
        if (intent == null || intent.isUnknown()) {
            say(props.getPrompts().getIntentNotUnderstood());
            transition(InteractionState.IDLE);
            return;
        }

        currentIntent = intent;
        recordIntent(intent);
        if (intent.confidence() >= props.getHighConfidenceThreshold()) {
            startDispatch(intent);
        } else {
            say(String.format(props.getPrompts().getConfirmIntent(), intent.humanSummary()));
            transition(InteractionState.INTENT_VALIDATION);
            gate.activate();
        }
    }

    /**
     * Waits up to {@code finalWaitMs} for finals still in flight so the turn sees all of them.
     */
    private void awaitOutstandingFinals() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(props.getFinalWaitMs());
        while (batcher.hasPendingFinals() && System.nanoTime() < deadline
                && state == InteractionState.PROCESSING) {
            batcher.pollEvent(FINAL_WAIT_POLL).ifPresent(this::handleEvent);
        }
        Optional<TranscriptionEvent> event;
        while (state == InteractionState.PROCESSING
                && (event = batcher.pollEvent(Duration.ZERO)).isPresent()) {
            handleEvent(event.get());
        }
    }

    private void onIntentValidation() {
        if (elapsedInState().toMillis() >= props.getConfirmationTimeoutMs()) {
            LOG.info("No confirmation within {} ms; cancelling", props.getConfirmationTimeoutMs());
            clearTurn();
            say(props.getPrompts().getCancelled());
            transition(InteractionState.IDLE);
        }
    }

    private void handleConfirmation(String text) {
        ConfirmationClassifier.Answer answer = ConfirmationClassifier.classify(text);
        LOG.debug("Confirmation answer: {}", answer);
        switch (answer) {
            case YES -> {
                if (currentIntent == null) {
                    transition(InteractionState.IDLE);
                } else {
                    startDispatch(currentIntent);
                }
            }
            case NO -> {
                clearTurn();
                say(props.getPrompts().getCancelled());
                transition(InteractionState.IDLE);
            }
            default -> {
                clearTurn();
                say(props.getPrompts().getPleaseRepeat());
                gate.activate();
                transition(InteractionState.LISTENING);
            }
        }
    }

    private void startDispatch(Intent intent) {
        gate.deactivate();
        commandsProcessed.incrementAndGet();
        LOG.info("Dispatching intent type={} confidence={}", intent.type(), intent.confidence());
        pendingDispatch = CompletableFuture
                .supplyAsync(() -> commandDispatcher.dispatch(intent), eventExecutor)
                .orTimeout(props.getDispatchTimeoutMs(), TimeUnit.MILLISECONDS);
        transition(InteractionState.AWAIT_RESPONSE);
    }

    private void onAwaitResponse() {
        CompletableFuture<CommandResult> future = pendingDispatch;
        if (future == null) {
            transition(InteractionState.IDLE);
            return;
        }
        if (!future.isDone()) {
            return;
        }
        pendingDispatch = null;
        Intent intent = currentIntent;
        CommandResult result;
        try {
            result = future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String outcome = cause instanceof TimeoutException ? "timeout" : "failure";
            metrics.incrementCommandDispatched(outcome);
            LOG.warn("Command dispatch {}: {}", outcome, cause.toString());
            clearTurn();
            say(props.getPrompts().getApology());
            transition(InteractionState.IDLE);
            return;
        }
        metrics.incrementCommandDispatched(result.success() ? "success" : "failure");
        clearTurn();
        if (!result.success()) {
            LOG.warn("Command reported failure for intent type={}", intent == null ? "?" : intent.type());
            say(props.getPrompts().getApology());
            transition(InteractionState.IDLE);
            return;
        }
        if (intent != null) {
            say(CompletionFeedback.format(intent, result));
            if (Intent.QUIT.equals(intent.type())) {
                terminate(false);
                return;
            }
        }
        transition(InteractionState.IDLE);
    }

    private void applyGlobalCommand(GlobalCommand command) {
        LOG.info("Global command: {}", command);
        switch (command) {
            case STOP -> terminate(true);
            case CANCEL -> {
                clearTurn();
                say(props.getPrompts().getCancelled());
                transition(InteractionState.IDLE);
            }
            case PAUSE -> {
                paused = true;
                say(props.getPrompts().getPaused());
            }
            case RESUME -> {
                paused = false;
                say(props.getPrompts().getResumed());
            }
            case RESTART -> {
                clearTurn();
                paused = false;
                say(props.getPrompts().getRestarted());
                transition(InteractionState.IDLE);
            }
        }
    }

    /** Caller holds intentLock. */
    private void terminate(boolean announce) {
        if (state == InteractionState.TERMINATED) {
            return;
        }
        clearTurn(false);
        if (batcher.forceFinalize()) {
            LOG.info("Flushed in-flight batch before terminating");
        }
        if (announce) {
            say(props.getPrompts().getStopping());
        }
        gate.deactivate();
        transition(InteractionState.TERMINATED);
        running.set(false);
        stopRequested.set(true);
        LOG.info("Interaction session {} terminated: {}", sessionId, stats());
    }

    private void clearTurn() {
        clearTurn(true);
    }

    /**
     * Drops the pending intent and fragments; with {@code discardAudio} also the batch in progress.
     */
    private void clearTurn(boolean discardAudio) {
        currentIntent = null;
        fragments.clear();
        CompletableFuture<CommandResult> dispatch = pendingDispatch;
        if (dispatch != null) {
            dispatch.cancel(true);
            pendingDispatch = null;
        }
        if (discardAudio) {
            batcher.discardActiveBatch();
        }
        gate.deactivate();
    }

    /** Caller holds intentLock; spoken by {@link #speakQueuedPrompts()} after release. */
    private void say(String text) {
        queuedPrompts.add(text);
    }

    private void speakQueuedPrompts() {
        List<String> prompts;
        intentLock.lock();
        try {
            if (queuedPrompts.isEmpty()) {
                return;
            }
            prompts = new ArrayList<>(queuedPrompts);
            queuedPrompts.clear();
        } finally {
            intentLock.unlock();
        }
        for (String prompt : prompts) {
            playback.say(prompt);
        }
    }

    private void recordIntent(Intent intent) {
        intentHistory.addLast(intent);
        while (intentHistory.size() > props.getIntentHistorySize()) {
            intentHistory.removeFirst();
        }
    }

    private void transition(InteractionState to) {
        InteractionState from = state;
        if (from == to) {
            return;
        }
        state = to;
        Instant now = clock.instant();
        stateEnteredAt = now;
        if (to == InteractionState.IDLE) {
            gate.deactivate();
        }
        LOG.info("State {} -> {}", from, to);
        publisher.publishEvent(new InteractionStateChangedEvent(from, to, now));
    }

    private Duration elapsedInState() {
        return Duration.between(stateEnteredAt, clock.instant());
    }

    public InteractionState getState() {
        return state;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    /** Intent awaiting confirmation or dispatch, if any. */
    public Optional<Intent> currentIntent() {
        intentLock.lock();
        try {
            return Optional.ofNullable(currentIntent);
        } finally {
            intentLock.unlock();
        }
    }

    /** Most recent intents, oldest first. */
    public List<Intent> intentHistory() {
        intentLock.lock();
        try {
            return List.copyOf(intentHistory);
        } finally {
            intentLock.unlock();
        }
    }

    public SessionStats stats() {
        return new SessionStats(segmentsProcessed.get(), batchesCompleted.get(), commandsProcessed.get(),
                echoesSuppressed.get(), sessionStart);
    }
}
