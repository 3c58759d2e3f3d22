package com.phillippitts.voicebridge.presentation.exception;

import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.ErrorCode;
import com.phillippitts.voicebridge.exception.InvalidAudioException;
import com.phillippitts.voicebridge.exception.QueueUnavailableException;
import com.phillippitts.voicebridge.exception.UnknownSessionException;
import com.phillippitts.voicebridge.exception.VoiceBridgeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - session does not exist or is already closed (HTTP 404).
     */
    @ExceptionHandler(UnknownSessionException.class)
    ResponseEntity<ApiError> handleUnknownSession(UnknownSessionException ex) {
        LOG.debug("Unknown session requested: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getErrorCode().wireName(),
                "Session not found",
                "The session does not exist or has been closed",
                Instant.now()
            ));
    }

    /**
     * Client error - rejected audio upload (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.debug("Rejected audio: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getErrorCode().wireName(),
                "Invalid audio",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - upload above the servlet multipart limit (HTTP 413).
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.debug("Upload above multipart limit: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(
                ErrorCode.INVALID_AUDIO.wireName(),
                "Invalid audio",
                "File too large",
                Instant.now()
            ));
    }

    /**
     * Admission limit reached - retry later (HTTP 429).
     */
    @ExceptionHandler(CapacityExceededException.class)
    ResponseEntity<ApiError> handleCapacityExceeded(CapacityExceededException ex) {
        LOG.warn("Capacity exceeded: limit={}", ex.getLimit());
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .body(new ApiError(
                ex.getErrorCode().wireName(),
                "Too many sessions or requests",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Transient error - broker unreachable (HTTP 503).
     */
    @ExceptionHandler(QueueUnavailableException.class)
    ResponseEntity<ApiError> handleQueueUnavailable(QueueUnavailableException ex) {
        LOG.error("Queue unavailable: topic={}", ex.getTopic(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getErrorCode().wireName(),
                "Transcription queue temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Other domain failures (HTTP 500).
     */
    @ExceptionHandler(VoiceBridgeException.class)
    ResponseEntity<ApiError> handleDomainFailure(VoiceBridgeException ex) {
        LOG.error("Request failed: code={}", ex.getErrorCode(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getErrorCode().wireName(),
                "Request could not be completed",
                "Please contact support with request ID",
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
