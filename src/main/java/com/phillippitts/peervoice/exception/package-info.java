/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.peervoice.exception.PeerVoiceException}. Collaborator failures are caught
 * at the loop boundaries and turned into log entries or spoken apologies; only those reaching the
 * REST layer become HTTP responses.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.peervoice.exception.TranscriptionException} - Recognizer failure,
 *       carries the engine name</li>
 *   <li>{@link com.phillippitts.peervoice.exception.ProcessExecutionException} - External process
 *       failed or timed out</li>
 *   <li>{@link com.phillippitts.peervoice.exception.SynthesisException} - Speech synthesis
 *       failure</li>
 *   <li>{@link com.phillippitts.peervoice.exception.IntentExtractionException} - No intent could be
 *       extracted from a turn</li>
 *   <li>{@link com.phillippitts.peervoice.exception.CommandDispatchException} - Command handler
 *       failure, carries the intent type</li>
 *   <li>{@link com.phillippitts.peervoice.exception.ModelNotFoundException} - Recognizer model or
 *       binary missing at startup (HTTP 503 when surfaced)</li>
 * </ul>
 *
 * @see com.phillippitts.peervoice.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.peervoice.exception;
