package com.smartseller.warranty.exception;

/**
 * Exception thrown on duplicate keys, double activation or a lost optimistic-concurrency race.
 *
 * @author Warranty Platform Team
 */
public class ConflictException extends RuntimeException {

    private final String reason;

    public ConflictException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
