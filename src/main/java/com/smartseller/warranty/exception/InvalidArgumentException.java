package com.smartseller.warranty.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when input fails range, format or schema validation.
 * Carries the offending fields so callers can fix all of them in one round trip.
 *
 * @author Warranty Platform Team
 */
public class InvalidArgumentException extends RuntimeException {

    private final List<FieldViolation> violations;

    public InvalidArgumentException(String field, String message, Object rejectedValue) {
        this(List.of(new FieldViolation(field, message, rejectedValue)));
    }

    public InvalidArgumentException(List<FieldViolation> violations) {
        super(buildMessage(violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    private static String buildMessage(List<FieldViolation> violations) {
        if (violations.size() == 1) {
            FieldViolation violation = violations.get(0);
            return String.format("Invalid %s: %s", violation.getField(), violation.getMessage());
        }
        return String.format("Request has %d invalid fields", violations.size());
    }

    /**
     * A single failed field check.
     */
    public static class FieldViolation {
        private final String field;
        private final String message;
        private final Object rejectedValue;

        public FieldViolation(String field, String message, Object rejectedValue) {
            this.field = field;
            this.message = message;
            this.rejectedValue = rejectedValue;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }
        public Object getRejectedValue() { return rejectedValue; }
    }
}
