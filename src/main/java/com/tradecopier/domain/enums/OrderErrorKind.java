package com.tradecopier.domain.enums;

/**
 * Failure category of an order outcome. {@link #NONE} on accepted outcomes.
 */
public enum OrderErrorKind {
    NONE,
    TRANSPORT,
    RATE_LIMITED,
    REJECTED,
    NOT_FOUND,
    DUPLICATE_KEY,
    AUTH,
    NOT_DISPATCHED
}
