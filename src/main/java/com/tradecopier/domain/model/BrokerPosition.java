package com.tradecopier.domain.model;

import com.tradecopier.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An open position as reported live by the venue for one account. Volume in lots; label is the
 * free-text label the position was opened with, null when none was given.
 */
@Value
@Builder
public class BrokerPosition {

    long positionId;
    long instrumentId;
    PositionSide side;
    BigDecimal volume;
    Instant openedAt;
    String label;
}
