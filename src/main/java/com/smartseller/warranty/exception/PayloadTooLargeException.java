package com.smartseller.warranty.exception;

/**
 * Exception thrown when an attachment exceeds the configured size limit.
 *
 * @author Warranty Platform Team
 */
public class PayloadTooLargeException extends RuntimeException {

    private final long maxBytes;
    private final long actualBytes;

    public PayloadTooLargeException(long maxBytes, long actualBytes) {
        super(String.format("Attachment of %d bytes exceeds the %d byte limit", actualBytes, maxBytes));
        this.maxBytes = maxBytes;
        this.actualBytes = actualBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public long getActualBytes() {
        return actualBytes;
    }
}
