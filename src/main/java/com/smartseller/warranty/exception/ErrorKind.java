package com.smartseller.warranty.exception;

import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by the REST error body and per-item bulk results.
 *
 * @author Warranty Platform Team
 */
public enum ErrorKind {
    INVALID_ARGUMENT("invalid_argument", HttpStatus.BAD_REQUEST),
    FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    CONFLICT("conflict", HttpStatus.CONFLICT),
    PAYLOAD_TOO_LARGE("payload_too_large", HttpStatus.PAYLOAD_TOO_LARGE),
    INVALID_STATE("invalid_state", HttpStatus.CONFLICT),
    INVALID_TRANSITION("invalid_transition", HttpStatus.UNPROCESSABLE_ENTITY),
    PRECONDITION_FAILED("precondition_failed", HttpStatus.PRECONDITION_FAILED),
    DEPENDENCY_FAILURE("dependency_failure", HttpStatus.SERVICE_UNAVAILABLE),
    DEADLINE_EXCEEDED("deadline_exceeded", HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL("internal", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus httpStatus;

    ErrorKind(String code, HttpStatus httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    /**
     * Classify a failure. Unknown exceptions are internal.
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof InvalidArgumentException) {
            return INVALID_ARGUMENT;
        }
        if (error instanceof ForbiddenException) {
            return FORBIDDEN;
        }
        if (error instanceof ResourceNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof ConflictException
                || error instanceof OptimisticLockingFailureException
                || error instanceof DataIntegrityViolationException) {
            return CONFLICT;
        }
        if (error instanceof PayloadTooLargeException) {
            return PAYLOAD_TOO_LARGE;
        }
        if (error instanceof InvalidTransitionException) {
            return INVALID_TRANSITION;
        }
        if (error instanceof InvalidStateException) {
            return INVALID_STATE;
        }
        if (error instanceof PreconditionFailedException) {
            return PRECONDITION_FAILED;
        }
        if (error instanceof DependencyFailureException) {
            return DEPENDENCY_FAILURE;
        }
        if (error instanceof DeadlineExceededException || error instanceof QueryTimeoutException) {
            return DEADLINE_EXCEEDED;
        }
        return INTERNAL;
    }
}
