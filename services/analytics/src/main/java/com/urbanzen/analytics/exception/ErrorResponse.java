package com.urbanzen.analytics.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of the analytics endpoints.
 *
 * Example JSON:
 * {
 *   "status": 422,
 *   "error": "Insufficient Data",
 *   "message": "Insufficient training data: 12 samples, at least 100 required",
 *   "path": "/api/v1/analytics/model/retrain",
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "details": {"available": 12, "required": 100}
 * }
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    @JsonProperty("status")
    int status,

    @JsonProperty("error")
    String error,

    @JsonProperty("message")
    String message,

    @JsonProperty("path")
    String path,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("details")
    Map<String, Object> details
) {
    public static ErrorResponse of(HttpStatus status, String error, String message, String path,
                                   Map<String, Object> details) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(),
                details != null ? Map.copyOf(details) : Map.of());
    }
}
