package com.phillippitts.peervoice.presentation.exception;

import com.phillippitts.peervoice.exception.ModelNotFoundException;
import com.phillippitts.peervoice.exception.PeerVoiceException;
import com.phillippitts.peervoice.exception.TranscriptionException;
import com.phillippitts.peervoice.presentation.controller.UnknownCommandException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesUnknownCommandReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnknownCommand(new UnknownCommandException("dance"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("UnknownCommandException");
        assertThat(response.getBody().details()).contains("pause");
    }

    @Test
    void verifiesStoppedSessionReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalState(new IllegalStateException("Interaction session ab12 has been stopped"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().errorCode()).isEqualTo("SessionUnavailable");
    }

    @Test
    void verifiesModelNotFoundReturns503WithoutPath() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleModelNotFound(new ModelNotFoundException("/secret/models/ggml.bin"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/secret/models");
        assertThat(response.getBody().errorCode()).isEqualTo("ModelNotFoundException");
    }

    @Test
    void verifiesPipelineFailureReturns503WithRetryHint() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleVoiceFailure(new TranscriptionException("engine busy: secret123", "whisper"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).contains("retry");
        assertThat(response.getBody().toString()).doesNotContain("secret123");
    }

    @Test
    void verifiesUnexpectedReturns500WithGenericBody() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new RuntimeException("stack trace details"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("stack trace details");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void verifiesModelNotFoundIsAPeerVoiceExceptionWithFriendlyMessage() {
        ModelNotFoundException ex = new ModelNotFoundException("/opt/whisper/ggml.bin");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleModelNotFound(ex);

        assertThat(ex).isInstanceOf(PeerVoiceException.class);
        assertThat(ex.getModelPath()).isEqualTo("/opt/whisper/ggml.bin");
        assertThat(response.getBody().message()).isEqualTo("Voice service unavailable");
        assertThat(response.getBody().details()).contains("Model not loaded");
    }
}
