package com.phillippitts.peervoice.presentation.exception;

import com.phillippitts.peervoice.exception.ModelNotFoundException;
import com.phillippitts.peervoice.exception.PeerVoiceException;
import com.phillippitts.peervoice.presentation.controller.UnknownCommandException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - unknown global command (HTTP 400).
     */
    @ExceptionHandler(UnknownCommandException.class)
    ResponseEntity<ApiError> handleUnknownCommand(UnknownCommandException ex) {
        LOG.warn("Unknown command requested: {}", ex.getCommand());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unknown command",
                "Allowed: stop, cancel, pause, resume, restart",
                Instant.now()
            ));
    }

    /**
     * Session already stopped or otherwise not in a usable state (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                "SessionUnavailable",
                "Session is not available",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Recognizer model or binary missing (HTTP 503). The path stays in the log only.
     */
    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.error("Model not found: {}", ex.getModelPath());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Voice service unavailable",
                "Model not loaded. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Transient pipeline error (HTTP 503).
     */
    @ExceptionHandler(PeerVoiceException.class)
    ResponseEntity<ApiError> handleVoiceFailure(PeerVoiceException ex) {
        LOG.error("Voice pipeline failure", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Voice service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
