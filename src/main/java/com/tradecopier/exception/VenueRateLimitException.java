package com.tradecopier.exception;

/**
 * The venue refused a request with REQUEST_FREQUENCY_EXCEEDED. Transient: retried like any other
 * transport failure, but reported as RATE_LIMITED when retries run out.
 */
public class VenueRateLimitException extends TransportException {

    public VenueRateLimitException(String message) {
        super(ErrorCode.VENUE_RATE_LIMITED, message);
    }
}
