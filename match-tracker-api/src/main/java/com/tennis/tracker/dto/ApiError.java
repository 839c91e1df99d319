package com.tennis.tracker.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Standardized error response format.
 *
 * @param accepted outcomes the match would have accepted instead, for out-of-order submissions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,
        String message,
        String path,
        List<String> accepted,
        Instant timestamp
) {
    public ApiError(String code, String message, String path, List<String> accepted) {
        this(code, message, path, accepted, Instant.now());
    }

    public ApiError(String code, String message, String path) {
        this(code, message, path, null, Instant.now());
    }
}
