package com.tradecontrol.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradecontrol.exception.ErrorCode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for failed operator API calls. {@code error.details} is omitted when empty; for a
 * rejected signal it holds one message per offending field.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final Failure error;

    private ApiErrorResponse(Failure error) {
        this.error = error;
    }

    public static ApiErrorResponse from(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(Failure.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : new LinkedHashMap<>(details))
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Failure {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
