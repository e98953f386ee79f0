package com.smartseller.warranty.exception;

/**
 * Exception thrown when the caller's role or identity does not permit the operation.
 *
 * @author Warranty Platform Team
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
