package com.tradecopier.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories of the copier, with the HTTP status the status API maps them to.
 * {@code retryable} codes describe conditions that clear on their own (connection loss, venue
 * throttling); a client may repeat the same request later.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400, false),
    UNAUTHORIZED("UNAUTHORIZED", 401, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    DUPLICATE_POSITION("DUPLICATE_POSITION", 409, false),
    ORDER_REJECTED("ORDER_REJECTED", 422, false),
    VENUE_RATE_LIMITED("VENUE_RATE_LIMITED", 429, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    TRANSPORT_ERROR("TRANSPORT_ERROR", 502, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
