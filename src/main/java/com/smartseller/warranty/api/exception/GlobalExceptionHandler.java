package com.smartseller.warranty.api.exception;

import com.smartseller.warranty.api.dto.ErrorResponse;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.DeadlineExceededException;
import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.exception.ErrorKind;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.InvalidTransitionException;
import com.smartseller.warranty.exception.PayloadTooLargeException;
import com.smartseller.warranty.exception.PreconditionFailedException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the warranty API.
 * Converts the service error taxonomy into standardized error responses; the error field
 * carries the taxonomy code.
 *
 * @author Warranty Platform Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle InvalidArgumentException.
     * Returns 400 BAD REQUEST with one entry per rejected field.
     */
    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgumentException(
            InvalidArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid argument: {}", ex.getMessage());

        List<Map<String, Object>> fieldErrors = new ArrayList<>();
        for (InvalidArgumentException.FieldViolation violation : ex.getViolations()) {
            fieldErrors.add(fieldError(violation.getField(), violation.getMessage(), violation.getRejectedValue()));
        }
        ErrorResponse error = build(ErrorKind.INVALID_ARGUMENT, ex.getMessage(), request);
        error.addDetail("fieldErrors", fieldErrors);

        return respond(ErrorKind.INVALID_ARGUMENT, error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation error: {}", ex.getMessage());

        List<Map<String, Object>> fieldErrors = new ArrayList<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.add(fieldError(fieldError.getField(), fieldError.getDefaultMessage(),
                    fieldError.getRejectedValue()));
        }
        ErrorResponse error = build(ErrorKind.INVALID_ARGUMENT, "Request validation failed", request);
        error.addDetail("fieldErrors", fieldErrors);

        return respond(ErrorKind.INVALID_ARGUMENT, error);
    }

    /**
     * Unreadable bodies, bad enum values in query parameters and missing parameters.
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request: {}", ex.getMessage());

        ErrorResponse error = build(ErrorKind.INVALID_ARGUMENT, "Malformed request", request);
        if (ex instanceof MethodArgumentTypeMismatchException) {
            MethodArgumentTypeMismatchException mismatch = (MethodArgumentTypeMismatchException) ex;
            error.addDetail("fieldErrors", List.of(
                    fieldError(mismatch.getName(), "Unsupported value", mismatch.getValue())));
        } else if (ex instanceof MissingServletRequestParameterException) {
            MissingServletRequestParameterException missing = (MissingServletRequestParameterException) ex;
            error.addDetail("fieldErrors", List.of(
                    fieldError(missing.getParameterName(), "Parameter is required", null)));
        }
        return respond(ErrorKind.INVALID_ARGUMENT, error);
    }

    /**
     * Handle PayloadTooLargeException.
     * Returns 413 PAYLOAD TOO LARGE.
     */
    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<ErrorResponse> handlePayloadTooLargeException(
            PayloadTooLargeException ex,
            HttpServletRequest request
    ) {
        logger.warn("Payload too large: {}", ex.getMessage());

        ErrorResponse error = build(ErrorKind.PAYLOAD_TOO_LARGE, ex.getMessage(), request);
        error.addDetail("maxBytes", ex.getMaxBytes());
        error.addDetail("actualBytes", ex.getActualBytes());

        return respond(ErrorKind.PAYLOAD_TOO_LARGE, error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when any resource doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = build(ErrorKind.NOT_FOUND, ex.getMessage(), request);
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return respond(ErrorKind.NOT_FOUND, error);
    }

    /**
     * Handle ConflictException.
     * Returns 409 CONFLICT with the machine-readable reason.
     */
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflictException(
            ConflictException ex,
            HttpServletRequest request
    ) {
        logger.warn("Conflict ({}): {}", ex.getReason(), ex.getMessage());

        ErrorResponse error = build(ErrorKind.CONFLICT, ex.getMessage(), request);
        error.addDetail("reason", ex.getReason());

        return respond(ErrorKind.CONFLICT, error);
    }

    /**
     * Lost optimistic-lock races and unique-constraint violations surface as conflicts.
     */
    @ExceptionHandler({OptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentModification(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        logger.warn("Concurrent modification: {}", ex.getMessage());

        String reason = ex instanceof OptimisticLockingFailureException ? "concurrent_update" : "duplicate";
        ErrorResponse error = build(ErrorKind.CONFLICT, "The resource was modified concurrently, retry the request",
                request);
        error.addDetail("reason", reason);

        return respond(ErrorKind.CONFLICT, error);
    }

    /**
     * Handle InvalidStateException and InvalidTransitionException.
     * Returns 409 CONFLICT, or 422 UNPROCESSABLE ENTITY for a claim transition outside the table.
     */
    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateException(
            InvalidStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid state: {}", ex.getMessage());

        ErrorKind kind = ErrorKind.of(ex);
        ErrorResponse error = build(kind, ex.getMessage(), request);
        error.addDetail("currentState", ex.getCurrentState());
        error.addDetail("allowedActions", ex.getAllowedActions());
        if (ex instanceof InvalidTransitionException) {
            error.addDetail("attemptedAction", ((InvalidTransitionException) ex).getAttemptedAction());
        }

        return respond(kind, error);
    }

    /**
     * Handle PreconditionFailedException.
     * Returns 412 PRECONDITION FAILED.
     */
    @ExceptionHandler(PreconditionFailedException.class)
    public ResponseEntity<ErrorResponse> handlePreconditionFailedException(
            PreconditionFailedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Precondition failed ({}): {}", ex.getReason(), ex.getMessage());

        ErrorResponse error = build(ErrorKind.PRECONDITION_FAILED, ex.getMessage(), request);
        error.addDetail("reason", ex.getReason());

        return respond(ErrorKind.PRECONDITION_FAILED, error);
    }

    /**
     * Handle ForbiddenException and Spring Security denials.
     * Returns 403 FORBIDDEN.
     */
    @ExceptionHandler({ForbiddenException.class, AccessDeniedException.class})
    public ResponseEntity<ErrorResponse> handleForbidden(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        logger.warn("Forbidden: {}", ex.getMessage());

        ErrorResponse error = build(ErrorKind.FORBIDDEN, ex.getMessage(), request);
        return respond(ErrorKind.FORBIDDEN, error);
    }

    @ExceptionHandler({DeadlineExceededException.class, QueryTimeoutException.class})
    public ResponseEntity<ErrorResponse> handleDeadlineExceeded(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        logger.warn("Deadline exceeded: {}", ex.getMessage());

        ErrorResponse error = build(ErrorKind.DEADLINE_EXCEEDED, "The operation timed out", request);
        return respond(ErrorKind.DEADLINE_EXCEEDED, error);
    }

    /**
     * Handle DependencyFailureException.
     * Returns 503 SERVICE UNAVAILABLE naming the failed collaborator.
     */
    @ExceptionHandler(DependencyFailureException.class)
    public ResponseEntity<ErrorResponse> handleDependencyFailure(
            DependencyFailureException ex,
            HttpServletRequest request
    ) {
        logger.error("Dependency {} failed: {}", ex.getDependency(), ex.getMessage());

        ErrorResponse error = build(ErrorKind.DEPENDENCY_FAILURE, ex.getMessage(), request);
        error.addDetail("dependency", ex.getDependency());

        return respond(ErrorKind.DEPENDENCY_FAILURE, error);
    }

    /**
     * Handle all other unexpected exceptions.
     * Returns 500 INTERNAL SERVER ERROR carrying only a correlation id; the stack trace is
     * logged under the same id.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        String correlationId = UUID.randomUUID().toString();
        logger.error("Unexpected error [{}] on {}", correlationId, request.getRequestURI(), ex);

        ErrorResponse error = build(ErrorKind.INTERNAL, "An unexpected error occurred", request);
        error.addDetail("correlationId", correlationId);

        return respond(ErrorKind.INTERNAL, error);
    }

    private static ErrorResponse build(ErrorKind kind, String message, HttpServletRequest request) {
        return ErrorResponse.of(kind, message, request.getRequestURI());
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorKind kind, ErrorResponse error) {
        return ResponseEntity.status(kind.getHttpStatus()).body(error);
    }

    private static Map<String, Object> fieldError(String field, String message, Object rejectedValue) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("field", field);
        entry.put("message", message);
        entry.put("rejectedValue", rejectedValue);
        return entry;
    }
}
