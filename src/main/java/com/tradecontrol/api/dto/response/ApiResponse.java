package com.tradecontrol.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Envelope for successful operator API responses: {@code {"success": true, "data": ..., "timestamp": ...}}.
 * Failures use {@link ApiErrorResponse} with the same {@code success} flag.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
