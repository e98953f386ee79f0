package com.smartseller.warranty.exception;

/**
 * Exception thrown when an operation runs past its deadline. Work already committed stays committed.
 *
 * @author Warranty Platform Team
 */
public class DeadlineExceededException extends RuntimeException {

    private final String operation;

    public DeadlineExceededException(String operation, Throwable cause) {
        super(String.format("Operation %s timed out", operation), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
