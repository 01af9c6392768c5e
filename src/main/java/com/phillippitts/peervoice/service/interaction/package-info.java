/**
 * Voice session orchestration.
 *
 * <p>This package owns a session from microphone activation to termination: it feeds audio to the
 * batcher, reads transcriptions back, confirms the recognized intent with the user, dispatches the
 * command and speaks the outcome without hearing itself.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.InteractionStateMachine} - Turn state
 *       machine driven by a periodic tick; the only writer of session state</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.AudioPipeline} - Capture loop feeding
 *       classified segments to the batcher while the microphone gate is open</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.MicrophoneGate} - Whether captured
 *       frames are classified at all</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.PlaybackCoordinator} - Speaks prompts
 *       with the gate suspended, followed by a cooldown</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.EchoSuppressor} - Rejects
 *       transcriptions that repeat what was just spoken</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.GlobalCommandDetector} - Stop, cancel,
 *       pause, resume and restart, honoured in every state</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.ConfirmationClassifier} and
 *       {@link com.phillippitts.peervoice.service.interaction.QuitPositionPolicy} - Yes/no answers and
 *       the ambiguous "quit" in the middle of a sentence</li>
 *   <li>{@link com.phillippitts.peervoice.service.interaction.ActivationTrigger} - Manual or
 *       continuous activation</li>
 * </ul>
 *
 * <p>States:
 * <ul>
 *   <li><b>IDLE:</b> gate closed, waiting for activation</li>
 *   <li><b>LISTENING:</b> collecting final transcriptions into the current turn</li>
 *   <li><b>PROCESSING:</b> extracting an intent from the turn</li>
 *   <li><b>INTENT_VALIDATION / AWAIT_RESPONSE:</b> the intent is read back and the user answers
 *       yes or no</li>
 *   <li><b>TERMINATED:</b> final; reached through "stop" or {@code stop()}</li>
 * </ul>
 * Every transition publishes an
 * {@link com.phillippitts.peervoice.service.interaction.InteractionStateChangedEvent}.
 *
 * <p>Thread Safety:
 * <ul>
 *   <li>Session state is guarded by a single intent lock held for the duration of a tick</li>
 *   <li>Prompts are queued under the lock and spoken after it is released, so queries from the
 *       REST layer never wait for synthesis</li>
 *   <li>The gate is written only by the state machine and the playback coordinator; the capture
 *       thread reads it once per frame</li>
 *   <li>Stopping flushes the batch in progress; cancel, restart and timeouts discard it</li>
 * </ul>
 *
 * @see com.phillippitts.peervoice.service.batch
 * @see com.phillippitts.peervoice.config.interaction.InteractionProperties
 * @since 1.0
 */
package com.phillippitts.peervoice.service.interaction;
