package com.phillippitts.platemate.presentation.exception;

import com.phillippitts.platemate.exception.AudioCaptureException;
import com.phillippitts.platemate.exception.ConversationBusyException;
import com.phillippitts.platemate.exception.ConversationException;
import com.phillippitts.platemate.exception.PermissionDeniedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts domain exceptions to HTTP responses. Upstream error text (API responses, device
 * names) is logged but never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * A reply is still pending (HTTP 409).
     */
    @ExceptionHandler(ConversationBusyException.class)
    ResponseEntity<ApiError> handleBusy(ConversationBusyException ex) {
        LOG.debug("Rejected request while busy");
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Assistant is busy",
                "Wait for the current reply before sending another message",
                Instant.now()
            ));
    }

    /**
     * User refused microphone or location access (HTTP 403).
     */
    @ExceptionHandler(PermissionDeniedException.class)
    ResponseEntity<ApiError> handlePermissionDenied(PermissionDeniedException ex) {
        LOG.warn("Permission denied: resource={}", ex.getResource());
        return ResponseEntity
            .status(HttpStatus.FORBIDDEN)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Permission denied",
                "Grant " + ex.getResource() + " access in system settings",
                Instant.now()
            ));
    }

    /**
     * Microphone or recognizer could not be started (HTTP 503).
     */
    @ExceptionHandler(AudioCaptureException.class)
    ResponseEntity<ApiError> handleAudioCapture(AudioCaptureException ex) {
        LOG.error("Audio capture failed: reason={}", ex.getReason(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Voice input unavailable",
                "Reason: " + ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Transient upstream error, retry possible (HTTP 503).
     */
    @ExceptionHandler(ConversationException.class)
    ResponseEntity<ApiError> handleConversationFailure(ConversationException ex) {
        LOG.error("Conversation failed: session={}", ex.getSessionToken(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Assistant temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Client error, invalid input (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
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
                "Please report the request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
