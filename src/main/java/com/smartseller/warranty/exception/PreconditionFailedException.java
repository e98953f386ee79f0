package com.smartseller.warranty.exception;

/**
 * Exception thrown when a business rule blocks an otherwise well-formed request,
 * e.g. an expired warranty or an unmet approval gate.
 *
 * @author Warranty Platform Team
 */
public class PreconditionFailedException extends RuntimeException {

    private final String reason;

    public PreconditionFailedException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
