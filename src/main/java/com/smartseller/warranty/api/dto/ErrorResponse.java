package com.smartseller.warranty.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smartseller.warranty.exception.ErrorKind;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned for every failed API call.
 *
 * {@code error} is the taxonomy code of the {@link ErrorKind} and {@code status} its HTTP status.
 * {@code details} holds the kind-specific fields (field errors, current state and legal actions,
 * size limits, correlation id) and is omitted when empty.
 *
 * @author Warranty Platform Team
 */
@Getter
public class ErrorResponse {

    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ErrorResponse(ErrorKind kind, String message, String path) {
        this.timestamp = Instant.now();
        this.status = kind.getHttpStatus().value();
        this.error = kind.getCode();
        this.message = message;
        this.path = path;
    }

    public static ErrorResponse of(ErrorKind kind, String message, String path) {
        return new ErrorResponse(kind, message, path);
    }

    /**
     * Attach a detail entry. Null values are skipped.
     */
    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
