package com.phillippitts.voiceinventory.presentation.exception;

import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.exception.PersistenceException;
import com.phillippitts.voiceinventory.exception.TaskNotReadyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
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
     * Confirmation requested too early (HTTP 409). Details list what still blocks it.
     */
    @ExceptionHandler(TaskNotReadyException.class)
    ResponseEntity<ApiError> handleTaskNotReady(TaskNotReadyException ex) {
        LOG.info("Task not ready: missing={}, unresolved={}", ex.getMissingFields(), ex.getUnresolvedReferences());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Task is not ready for confirmation",
                "missing=" + ex.getMissingFields() + ", unresolved=" + ex.getUnresolvedReferences(),
                Instant.now()
            ));
    }

    /**
     * Operation not valid in the current session state (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Rejected operation: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                "IllegalState",
                "Operation not allowed in the current state",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Storage failure (HTTP 503). The storage message is passed through; the task stays active.
     */
    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistence(PersistenceException ex) {
        LOG.error("Persistence failed: recordType={}", ex.getRecordType(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Record could not be saved",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Extraction failure, status by kind: 429 rate limited, 422 unusable model reply, 400 invalid
     * input, 502 unreachable model or rejected request, 503 not configured or rejected key, 409 cancelled.
     */
    @ExceptionHandler(ExtractionException.class)
    ResponseEntity<ApiError> handleExtraction(ExtractionException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case MALFORMED_RESPONSE, CONTENT_FILTERED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case NETWORK, UPSTREAM_REJECTED -> HttpStatus.BAD_GATEWAY;
            case NOT_CONFIGURED -> HttpStatus.SERVICE_UNAVAILABLE;
            case CANCELLED -> HttpStatus.CONFLICT;
        };
        if (status.is5xxServerError()) {
            LOG.error("Extraction failed: kind={}", ex.getKind(), ex);
        } else {
            LOG.warn("Extraction failed: kind={}, message={}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Extraction failed (" + ex.getKind() + ")",
                ex.isRetryable() ? "Please retry" : ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return badRequest("InvalidRequest", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getField)
            .map(field -> field + " is required")
            .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return badRequest("ValidationFailed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("UnreadableBody", "Request body is missing or malformed");
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

    private static ResponseEntity<ApiError> badRequest(String errorCode, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, "Invalid request", details, Instant.now()));
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
