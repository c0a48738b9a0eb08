package com.cred.freestyle.catalog.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error envelope returned by every catalog endpoint.
 *
 * {@code details} holds error-specific fields in insertion order (field errors, the committed
 * revision of a partially propagated write, the aggregate that conflicted) and is left out
 * of the body when empty.
 *
 * @author Catalog Team
 */
public class ErrorResponse {

    private final Instant timestamp = Instant.now();
    private final HttpStatus httpStatus;
    private final String error;
    private final String message;
    private final String path;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(HttpStatus httpStatus, String error, String message, String path) {
        this.httpStatus = httpStatus;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public ErrorResponse withDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public ResponseEntity<ErrorResponse> toResponseEntity() {
        return ResponseEntity.status(httpStatus).body(this);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getStatus() {
        return httpStatus.value();
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
