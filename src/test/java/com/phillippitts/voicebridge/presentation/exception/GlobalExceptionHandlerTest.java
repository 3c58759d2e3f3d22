package com.phillippitts.voicebridge.presentation.exception;

import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.ErrorCode;
import com.phillippitts.voicebridge.exception.InvalidAudioException;
import com.phillippitts.voicebridge.exception.ProviderException;
import com.phillippitts.voicebridge.exception.QueueUnavailableException;
import com.phillippitts.voicebridge.exception.UnknownSessionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesUnknownSessionReturns404() {
        ResponseEntity<?> response = handler.handleUnknownSession(new UnknownSessionException("abc"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("errorCode=unknown_session");
        assertThat(response.getBody().toString()).contains("Session not found");
    }

    @Test
    void verifiesCapacityExceededReturns429() {
        CapacityExceededException ex = new CapacityExceededException("10.0.0.1",
                CapacityExceededException.Limit.GLOBAL_SESSIONS, "Server session limit reached");

        ResponseEntity<?> response = handler.handleCapacityExceeded(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody().toString()).contains("errorCode=capacity_exceeded");
    }

    @Test
    void verifiesCapacityExceededDoesNotLeakClientKey() {
        CapacityExceededException ex = new CapacityExceededException("10.0.0.1",
                CapacityExceededException.Limit.RATE, "Too many connection attempts");

        ResponseEntity<?> response = handler.handleCapacityExceeded(ex);

        assertThat(response.getBody().toString()).doesNotContain("10.0.0.1");
    }

    @Test
    void verifiesInvalidAudioReturns400WithReason() {
        ResponseEntity<?> response = handler.handleInvalidAudio(
                new InvalidAudioException("Unsupported audio format. Supported formats: wav,mp3"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("errorCode=invalid_audio")
                .contains("Supported formats: wav,mp3");
    }

    @Test
    void verifiesMultipartLimitReturns413() {
        ResponseEntity<?> response = handler.handleUploadTooLarge(new MaxUploadSizeExceededException(12L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(response.getBody().toString()).contains("errorCode=invalid_audio");
    }

    @Test
    void verifiesQueueUnavailableReturns503() {
        ResponseEntity<?> response = handler.handleQueueUnavailable(
                new QueueUnavailableException("audio.segments", new RuntimeException("down")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("queue_unavailable");
    }

    @Test
    void verifiesDomainFailureReturns500WithCode() {
        ResponseEntity<?> response = handler.handleDomainFailure(new ProviderException("boom", "mock"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("errorCode=" + ErrorCode.PROVIDER_ERROR.wireName());
        assertThat(response.getBody().toString()).doesNotContain("boom");
    }

    @Test
    void verifiesUnexpectedErrorDoesNotLeakDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("An unexpected error occurred");
        assertThat(response.getBody().toString()).doesNotContain("secret internals");
    }

    @Test
    void verifiesResponseContainsTimestamp() {
        Instant beforeCall = Instant.now().minusSeconds(1);

        ResponseEntity<?> response = handler.handleUnknownSession(new UnknownSessionException("abc"));

        assertThat(response.getBody().toString()).contains("timestamp=");
        GlobalExceptionHandler.ApiError body = (GlobalExceptionHandler.ApiError) response.getBody();
        assertThat(body.timestamp()).isAfter(beforeCall);
    }
}
