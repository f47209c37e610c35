package com.tradecopier.api.dto.response;

import com.tradecopier.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body of the status API. {@code retryable} is true for failures that clear without
 * intervention, such as a request made while the session is reconnecting.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .details(details != null ? details : Map.of())
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
