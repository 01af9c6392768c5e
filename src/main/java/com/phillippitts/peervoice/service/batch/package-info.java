/**
 * Utterance batching and the partial/final transcription loop.
 *
 * <p>This package turns the stream of classified {@link com.phillippitts.peervoice.domain.AudioSegment}s
 * produced by the capture pipeline into utterance-sized batches, and hands those batches to a
 * {@link com.phillippitts.peervoice.service.stt.SpeechRecognizer}.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.peervoice.service.batch.SpeechBatcher} - Applies the batching rules
 *       on the capture thread and runs a daemon loop that dispatches recognition work and re-checks
 *       pauses when no segment arrives</li>
 *   <li>{@link com.phillippitts.peervoice.service.batch.SpeechBatch} - Mutable audio buffer of one
 *       utterance; mutated only under the batcher's lock</li>
 *   <li>{@link com.phillippitts.peervoice.service.batch.PauseThresholdPolicy} - Short-pause shortcut
 *       and the long-pause threshold that grows with batch length</li>
 *   <li>{@link com.phillippitts.peervoice.service.batch.TranscriptionEvent} - Partial or final text
 *       delivered to the interaction layer</li>
 *   <li>{@link com.phillippitts.peervoice.service.batch.BatcherStatistics} - Snapshot for the status
 *       endpoint and shutdown log</li>
 * </ul>
 *
 * <p>Batch Lifecycle:
 * <ul>
 *   <li><b>Held:</b> speech shorter than {@code minSegmentMs} is held until enough audio has
 *       accumulated; silence never drops held speech</li>
 *   <li><b>Active / Paused:</b> speech appends, silence marks the batch paused until a pause rule
 *       fires</li>
 *   <li><b>Finalized:</b> reason PAUSE, LONG_PAUSE, MAX_DURATION, FORCED or SHUTDOWN; exactly one
 *       final request is queued</li>
 * </ul>
 *
 * <p>Queues and Ordering:
 * <ul>
 *   <li>Partials are capped at {@code requestQueueCapacity}; extra partials are skipped</li>
 *   <li>Finals are always queued and only the loop (or {@code stop()}) submits them, so the capture
 *       thread never runs recognition</li>
 *   <li>Finals may transcribe in parallel on the {@code transcriptionExecutor}; their events are
 *       emitted in finalization order</li>
 *   <li>A partial completing after its batch has moved on is discarded</li>
 *   <li>When the event queue reaches {@code eventQueueCapacity}, partials give way; finals are
 *       never dropped</li>
 * </ul>
 *
 * <p>Failures: a recognizer error or a timeout after {@code recognitionTimeoutMs} is counted in
 * {@code peervoice.transcription.failure} and the final carries empty text.
 *
 * <p>Usage:
 * <pre>{@code
 * batcher.start();
 * batcher.addSegment(segment);                 // capture thread
 * batcher.pollEvent(Duration.ofMillis(100))    // state machine
 *        .ifPresent(this::onTranscription);
 * batcher.stop();                              // flushes and waits for finals
 * }</pre>
 *
 * @see com.phillippitts.peervoice.config.batching.BatchingProperties
 * @see com.phillippitts.peervoice.service.interaction.InteractionStateMachine
 * @since 1.0
 */
package com.phillippitts.peervoice.service.batch;
