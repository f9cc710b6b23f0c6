package com.tribrid.studio.api.advice;

import com.tribrid.studio.api.dto.ApiResponse;
import com.tribrid.studio.control.TrainingControlException;
import com.tribrid.studio.telemetry.RunActionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", details, null));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
            MissingServletRequestParameterException ex) {
        log.warn("Missing parameter: {}", ex.getParameterName());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "VALIDATION_ERROR"));
    }

    /**
     * Handles guarded actions rejected by the run state.
     */
    @ExceptionHandler(RunActionException.class)
    public ResponseEntity<ApiResponse<Void>> handleRunActionException(RunActionException ex) {
        log.warn("Run action rejected: {} [{}]", ex.getMessage(), ex.getErrorCode());

        HttpStatus status = switch (ex.getErrorCode()) {
            case RunActionException.RUN_NOT_SELECTED -> HttpStatus.NOT_FOUND;
            case RunActionException.RUN_NOT_CANCELLABLE, RunActionException.RUN_NOT_PROMOTABLE -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), null, ex.getRunId()));
    }

    /**
     * Handles failures and rejections of the Training Control API.
     */
    @ExceptionHandler(TrainingControlException.class)
    public ResponseEntity<ApiResponse<Void>> handleTrainingControlException(TrainingControlException ex) {
        log.error("Training Control API error: {} [{}]", ex.getMessage(), ex.getErrorCode());

        String details = ex.getHttpStatus() > 0 ? "upstream status " + ex.getHttpStatus() : null;
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), details, ex.getRunId()));
    }

    /**
     * Handles resource not found.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    /**
     * Handles illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage(),
                        null
                ));
    }
}
