package com.phillippitts.captionhub.presentation.exception;

import com.phillippitts.captionhub.exception.ChannelNotFoundException;
import com.phillippitts.captionhub.exception.InvalidSegmentException;
import com.phillippitts.captionhub.exception.InvalidStateTransitionException;
import com.phillippitts.captionhub.exception.SessionNotFoundException;
import com.phillippitts.captionhub.exception.SessionStartException;
import com.phillippitts.captionhub.exception.UnsupportedLanguageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

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
     * Lifecycle operation invoked out of order (HTTP 409). Nothing was changed.
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    ResponseEntity<ApiError> handleInvalidTransition(InvalidStateTransitionException ex) {
        LOG.warn("Rejected transition: session={}, {} -> {}",
                ex.getSessionId(), ex.getCurrentState(), ex.getRequestedState());
        return respond(HttpStatus.CONFLICT, ex, "Invalid session state transition", ex.getMessage());
    }

    @ExceptionHandler({SessionNotFoundException.class, ChannelNotFoundException.class})
    ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
        LOG.info("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex, "Resource not found", ex.getMessage());
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({UnsupportedLanguageException.class, InvalidSegmentException.class})
    ResponseEntity<ApiError> handleInvalidInput(RuntimeException ex) {
        LOG.warn("Invalid input: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return respond(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex, "Invalid request", "Malformed JSON body");
    }

    /**
     * A channel could not be opened (HTTP 503). The session stays startable.
     */
    @ExceptionHandler(SessionStartException.class)
    ResponseEntity<ApiError> handleStartFailure(SessionStartException ex) {
        LOG.error("Session start failed: session={}", ex.getSessionId(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, "Session could not be started",
                "Please retry in a few seconds");
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

    private static ResponseEntity<ApiError> respond(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
