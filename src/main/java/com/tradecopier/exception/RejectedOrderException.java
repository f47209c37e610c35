package com.tradecopier.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Business rejection from the venue (bad volume, unknown symbol, not enough margin, ...).
 * Never retried.
 */
@Getter
public class RejectedOrderException extends BaseException {

    private final String venueErrorCode;

    public RejectedOrderException(String venueErrorCode, String message) {
        super(
                ErrorCode.ORDER_REJECTED,
                message,
                Map.of("venueErrorCode", venueErrorCode != null ? venueErrorCode : "UNKNOWN"));
        this.venueErrorCode = venueErrorCode;
    }
}
