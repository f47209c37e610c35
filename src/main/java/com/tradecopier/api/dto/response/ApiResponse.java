package com.tradecopier.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/** Success body of the status API. {@code count} is set when {@code data} is a list. */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.data = data;
        this.count = data instanceof Collection<?> collection ? collection.size() : null;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
