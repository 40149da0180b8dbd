package com.example.rbac.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * JSON error body. {@code correlationId} matches the {@code X-Correlation-Id} response header.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId,
        List<String> problems
) {
    public static ErrorResponse of(int status, String error, String message, String path, String correlationId) {
        return new ErrorResponse(Instant.now(), status, error, message, path, correlationId, List.of());
    }

    public ErrorResponse withProblems(List<String> problems) {
        return new ErrorResponse(timestamp, status, error, message, path, correlationId, List.copyOf(problems));
    }
}
