package com.tradecopier.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Value;

/** Latest bid/ask for an instrument, already scaled to price units. */
@Value
public class SpotQuote {

    long instrumentId;
    BigDecimal bid;
    BigDecimal ask;
    Instant receivedAt;

    public BigDecimal getMid() {
        if (bid == null || ask == null) {
            return bid != null ? bid : ask;
        }
        return bid.add(ask).divide(BigDecimal.valueOf(2), 10, RoundingMode.HALF_UP);
    }
}
