package com.phillippitts.peervoice.service.batch;

import com.phillippitts.peervoice.config.batching.BatchingProperties;
import com.phillippitts.peervoice.domain.AudioSegment;
import com.phillippitts.peervoice.domain.TranscriptionResult;
import com.phillippitts.peervoice.service.metrics.VoiceMetrics;
import com.phillippitts.peervoice.service.stt.SpeechRecognizer;
import com.phillippitts.peervoice.util.LogSanitizer;
import com.phillippitts.peervoice.util.ProcessTimeouts;
import com.phillippitts.peervoice.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a stream of classified segments into utterance batches.
 *
 * <p>{@link #addSegment(AudioSegment)} applies the batching rules synchronously under the batch
 * lock and never blocks on recognition: partial and final requests go onto a request queue that a
 * daemon loop hands to the transcription executor. Only the loop (and {@link #stop()}, after the
 * loop has exited) submits recognition work, so the capture thread never runs a recognizer call.
 * Partials are capped at {@code requestQueueCapacity} queued requests; finals are never refused.
 * The same loop re-checks pauses every {@code pollTimeoutMs} so a batch finalizes even when no
 * further segment arrives.
 *
 * <p><b>Micro-segments:</b> speech shorter than {@code minSegmentMs} is held and merged into the
 * next batch. A batch opens once held audio reaches {@code minSegmentMs}, so capture frames shorter
 * than the minimum still form utterances. Held speech is never dropped by silence.
 *
 * <p><b>Ordering:</b> final transcriptions may run in parallel but their events are emitted in
 * submission order. Partials carry a generation number; a partial whose generation is no longer
 * current when it starts or completes is dropped.
 *
 * <p><b>Failures:</b> a recognizer error or timeout is logged and treated as empty text. A final
 * always produces an event, possibly with empty text. When the event queue is at
 * {@code eventQueueCapacity}, partials give way: the oldest queued partial is evicted, or the
 * incoming partial is dropped. Finals are never evicted.
 */
public class SpeechBatcher {

    private static final Logger LOG = LogManager.getLogger(SpeechBatcher.class);

    static final String KIND_PARTIAL = "partial";
    static final String KIND_FINAL = "final";

    private final BatchingProperties props;
    private final SpeechRecognizer recognizer;
    private final Executor transcriptionExecutor;
    private final Clock clock;
    private final VoiceMetrics metrics;
    private final int sampleRate;
    private final PauseThresholdPolicy pausePolicy;

    private final Lock batchLock = new ReentrantLock();
    // Guarded by batchLock
    private SpeechBatch activeBatch;
    private final List<AudioSegment> pendingMicroSegments = new ArrayList<>();
    private int pendingSamples;
    private final Deque<SpeechBatch> completedBatches = new ArrayDeque<>();

    private final BlockingQueue<TranscriptionRequest> requests = new LinkedBlockingQueue<>();
    private final AtomicInteger queuedPartials = new AtomicInteger();
    private final BlockingQueue<TranscriptionEvent> events = new LinkedBlockingQueue<>();
    private final Object eventLock = new Object();

    private final AtomicLong batchSequence = new AtomicLong();
    private final AtomicLong partialGeneration = new AtomicLong();
    private final AtomicInteger pendingFinals = new AtomicInteger();
    private final Set<CompletableFuture<?>> inFlightPartials = ConcurrentHashMap.newKeySet();
    private final Object finalChainLock = new Object();
    private CompletableFuture<Void> finalChain = CompletableFuture.completedFuture(null);

    private final AtomicLong segmentsProcessed = new AtomicLong();
    private final AtomicLong batchesCompleted = new AtomicLong();
    private final AtomicLong completedAudioNanos = new AtomicLong();
    private final AtomicLong finalTranscriptionCount = new AtomicLong();
    private final AtomicLong finalTranscriptionMillis = new AtomicLong();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Thread loopThread;

    public SpeechBatcher(BatchingProperties props,
                         SpeechRecognizer recognizer,
                         Executor transcriptionExecutor,
                         Clock clock,
                         VoiceMetrics metrics,
                         int sampleRate) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
        this.transcriptionExecutor = Objects.requireNonNull(transcriptionExecutor,
                "transcriptionExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        this.sampleRate = sampleRate;
        this.pausePolicy = new PauseThresholdPolicy(props);
    }

    /**
     * Starts the processing loop. Idempotent; a stopped batcher cannot be restarted.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("SpeechBatcher has been stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::runLoop, "speech-batcher");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        LOG.info("Speech batcher started (engine={}, maxBatchMs={}, shortPauseMs={}, longPauseBaseMs={})",
                recognizer.getEngineName(), props.getMaxBatchMs(), props.getShortPauseMs(),
                props.getLongPauseBaseMs());
    }

    /**
     * Adds one classified segment. Never blocks on recognition. Ignored once stopped.
     */
    public void addSegment(AudioSegment segment) {
        if (segment == null || stopped.get()) {
            return;
        }
        segmentsProcessed.incrementAndGet();
        batchLock.lock();
        try {
            if (segment.hasSpeech() && segment.sampleCount() > 0) {
                onSpeech(segment);
            } else {
                onSilence(segment.timestamp());
            }
        } finally {
            batchLock.unlock();
        }
    }

    private void onSpeech(AudioSegment segment) {
        if (activeBatch == null) {
            pendingMicroSegments.add(segment);
            pendingSamples += segment.sampleCount();
            if (TimeUtils.samplesToDuration(pendingSamples, sampleRate).toMillis() < props.getMinSegmentMs()) {
                LOG.trace("Holding micro-segment ({} samples, {} held)", segment.sampleCount(), pendingSamples);
                return;
            }
            openBatchFromPending();
        } else {
            activeBatch.append(segment);
        }

        if (activeBatch.duration().toMillis() > props.getMaxBatchMs()) {
            finalizeActive(FinalizationReason.MAX_DURATION);
            return;
        }
        if (activeBatch.segmentCount() % props.getPartialInterval() == 0) {
            int windowSamples = TimeUtils.millisToSamples(props.getPartialWindowMs(), sampleRate);
            long generation = partialGeneration.incrementAndGet();
            if (queuedPartials.incrementAndGet() > props.getRequestQueueCapacity()) {
                queuedPartials.decrementAndGet();
                LOG.debug("Request queue full; skipping partial for batch {}", activeBatch.getId());
            } else {
                requests.add(TranscriptionRequest.partial(
                        activeBatch.getId(), activeBatch.tail(windowSamples), generation));
            }
        }
    }

    private void onSilence(Instant now) {
        if (activeBatch == null) {
            return;
        }
        Duration pause = Duration.between(activeBatch.getLastActivity(), now);
        Optional<FinalizationReason> reason =
                pausePolicy.evaluate(activeBatch.segmentCount(), activeBatch.duration(), pause);
        if (reason.isPresent()) {
            finalizeActive(reason.get());
        } else {
            activeBatch.markPaused();
        }
    }

    /** Caller holds batchLock and has checked there is no active batch. */
    private void openBatchFromPending() {
        activeBatch = new SpeechBatch(batchSequence.incrementAndGet(), sampleRate,
                pendingMicroSegments.get(0).timestamp());
        for (AudioSegment pending : pendingMicroSegments) {
            activeBatch.append(pending);
        }
        clearPending();
        LOG.debug("Opened batch {}", activeBatch.getId());
    }

    private void clearPending() {
        pendingMicroSegments.clear();
        pendingSamples = 0;
    }

    /** Caller holds batchLock. */
    private void finalizeActive(FinalizationReason reason) {
        SpeechBatch batch = activeBatch;
        activeBatch = null;
        if (batch == null) {
            return;
        }
        batch.complete(reason);
        partialGeneration.incrementAndGet();
        completedBatches.addLast(batch);
        while (completedBatches.size() > props.getCompletedHistorySize()) {
            completedBatches.removeFirst();
        }
        batchesCompleted.incrementAndGet();
        completedAudioNanos.addAndGet(batch.duration().toNanos());
        metrics.recordBatchFinalized(reason.name());

        pendingFinals.incrementAndGet();
        requests.add(TranscriptionRequest.finalRequest(batch.getId(), batch.getSamples()));
        LOG.info("Finalized batch {} (reason={}, segments={}, durationMs={})",
                batch.getId(), reason, batch.segmentCount(), batch.duration().toMillis());
    }

    /**
     * Housekeeping pause check against the clock, for when no segment arrives.
     */
    void checkPauses() {
        batchLock.lock();
        try {
            onSilence(clock.instant());
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * Finalizes the active batch now with reason FORCED.
     *
     * @return true if a batch was finalized
     */
    public boolean forceFinalize() {
        batchLock.lock();
        try {
            if (activeBatch == null) {
                return false;
            }
            finalizeActive(FinalizationReason.FORCED);
            return true;
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * Drops the active batch and pending micro-segments without transcribing them.
     */
    public void discardActiveBatch() {
        batchLock.lock();
        try {
            if (activeBatch != null) {
                LOG.debug("Discarding active batch {}", activeBatch.getId());
            }
            activeBatch = null;
            clearPending();
            partialGeneration.incrementAndGet();
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * Drains the finalized batches not yet popped, oldest first.
     */
    public List<SpeechBatch> popCompletedBatches() {
        batchLock.lock();
        try {
            List<SpeechBatch> out = new ArrayList<>(completedBatches);
            completedBatches.clear();
            return out;
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next transcription event.
     */
    public Optional<TranscriptionEvent> pollEvent(Duration timeout) {
        try {
            return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public boolean hasPendingFinals() {
        return pendingFinals.get() > 0;
    }

    public boolean hasActiveBatch() {
        batchLock.lock();
        try {
            return activeBatch != null;
        } finally {
            batchLock.unlock();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public BatcherStatistics statistics() {
        long finals = finalTranscriptionCount.get();
        double avg = finals == 0 ? 0.0 : (double) finalTranscriptionMillis.get() / finals;
        return new BatcherStatistics(segmentsProcessed.get(), batchesCompleted.get(),
                Duration.ofNanos(completedAudioNanos.get()), avg);
    }

    /**
     * Flushes the active batch (reason SHUTDOWN), stops the loop, dispatches queued finals and waits
     * a bounded time for them. In-flight partials are cancelled. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        batchLock.lock();
        try {
            if (activeBatch == null && !pendingMicroSegments.isEmpty()) {
                openBatchFromPending();
            }
            finalizeActive(FinalizationReason.SHUTDOWN);
        } finally {
            batchLock.unlock();
        }
        running.set(false);
        Thread t = loopThread;
        if (t != null) {
            try {
                t.join(ProcessTimeouts.LOOP_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loopThread = null;
        }

        List<TranscriptionRequest> leftover = new ArrayList<>();
        requests.drainTo(leftover);
        queuedPartials.set(0);
        for (TranscriptionRequest request : leftover) {
            if (request.isFinal()) {
                submitFinal(request);
            }
        }

        CompletableFuture<Void> chain;
        synchronized (finalChainLock) {
            chain = finalChain;
        }
        try {
            chain.get(ProcessTimeouts.FINAL_TRANSCRIPTION_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Timed out waiting for {} final transcription(s) during shutdown", pendingFinals.get());
        } catch (ExecutionException e) {
            LOG.warn("Final transcription chain failed during shutdown: {}", e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (CompletableFuture<?> partial : inFlightPartials) {
            partial.cancel(true);
        }
        inFlightPartials.clear();
        LOG.info("Speech batcher stopped: {}", statistics());
    }

    private void runLoop() {
        long pollMs = props.getPollTimeoutMs();
        while (running.get()) {
            try {
                TranscriptionRequest request = requests.poll(pollMs, TimeUnit.MILLISECONDS);
                if (request != null) {
                    if (!request.isFinal()) {
                        queuedPartials.decrementAndGet();
                    }
                    dispatch(request);
                }
                checkPauses();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                LOG.error("Speech batcher loop error: {}", e.toString(), e);
            }
        }
        LOG.debug("Speech batcher loop exited");
    }

    private void dispatch(TranscriptionRequest request) {
        if (request.isFinal()) {
            submitFinal(request);
        } else {
            submitPartial(request);
        }
    }

    private void submitPartial(TranscriptionRequest request) {
        if (request.generation() != partialGeneration.get()) {
            LOG.trace("Skipping superseded partial for batch {}", request.batchId());
            return;
        }
        CompletableFuture<TranscriptionResult> future = CompletableFuture
                .supplyAsync(() -> recognizeTimed(request, KIND_PARTIAL), transcriptionExecutor)
                .orTimeout(props.getRecognitionTimeoutMs(), TimeUnit.MILLISECONDS);
        inFlightPartials.add(future);
        future.whenComplete((result, ex) -> {
            inFlightPartials.remove(future);
            if (ex != null) {
                recordFailure(KIND_PARTIAL, request.batchId(), ex);
                return;
            }
            if (request.generation() != partialGeneration.get() || result.isBlank()) {
                return;
            }
            emit(new TranscriptionEvent(request.batchId(), result));
        });
    }

    private void submitFinal(TranscriptionRequest request) {
        CompletableFuture<TranscriptionResult> task = CompletableFuture
                .supplyAsync(() -> recognizeTimed(request, KIND_FINAL), transcriptionExecutor)
                .orTimeout(props.getRecognitionTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    recordFailure(KIND_FINAL, request.batchId(), ex);
                    return TranscriptionResult.empty(true, recognizer.getEngineName());
                });
        synchronized (finalChainLock) {
            finalChain = finalChain.thenCombine(task, (ignored, result) -> {
                emit(new TranscriptionEvent(request.batchId(), result));
                pendingFinals.decrementAndGet();
                return null;
            });
        }
    }

    private TranscriptionResult recognizeTimed(TranscriptionRequest request, String kind) {
        long start = System.nanoTime();
        TranscriptionResult result = recognizer.recognize(request.samples(), request.isFinal());
        long elapsed = System.nanoTime() - start;
        metrics.recordTranscriptionLatency(kind, elapsed);
        if (request.isFinal()) {
            finalTranscriptionCount.incrementAndGet();
            finalTranscriptionMillis.addAndGet(TimeUtils.nanosToMillis(elapsed));
        }
        LOG.debug("{} transcription for batch {} in {} ms: '{}'", kind, request.batchId(),
                TimeUtils.nanosToMillis(elapsed), LogSanitizer.preview(result.text()));
        return result;
    }

    private void recordFailure(String kind, long batchId, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof CancellationException) {
            return;
        }
        String reason = cause instanceof TimeoutException ? "timeout" : "error";
        metrics.incrementTranscriptionFailure(kind, reason);
        LOG.warn("{} transcription failed for batch {} ({}): {}", kind, batchId, reason, cause.toString());
    }

    private void emit(TranscriptionEvent event) {
        synchronized (eventLock) {
            if (events.size() >= props.getEventQueueCapacity() && !evictOldestPartial()) {
                if (!event.isFinal()) {
                    LOG.debug("Transcription event queue full; dropped partial for batch {}", event.batchId());
                    return;
                }
                LOG.warn("Transcription event queue over capacity ({}); keeping final for batch {}",
                        events.size(), event.batchId());
            }
            events.add(event);
        }
    }

    /** Caller holds eventLock. */
    private boolean evictOldestPartial() {
        Iterator<TranscriptionEvent> it = events.iterator();
        while (it.hasNext()) {
            TranscriptionEvent queued = it.next();
            if (!queued.isFinal()) {
                it.remove();
                LOG.debug("Transcription event queue full; evicted partial for batch {}", queued.batchId());
                return true;
            }
        }
        return false;
    }

    /**
     * Work item for the processing loop.
     */
    record TranscriptionRequest(long batchId, float[] samples, boolean isFinal, long generation) {

        static TranscriptionRequest partial(long batchId, float[] samples, long generation) {
            return new TranscriptionRequest(batchId, samples, false, generation);
        }

        static TranscriptionRequest finalRequest(long batchId, float[] samples) {
            return new TranscriptionRequest(batchId, samples, true, -1L);
        }
    }
}
