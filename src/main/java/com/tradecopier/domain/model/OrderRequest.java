package com.tradecopier.domain.model;

import com.tradecopier.domain.enums.OrderKind;
import com.tradecopier.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An order sent to the slave account. For {@link OrderKind#MARKET_OPEN} {@code linkedPositionId}
 * is the master position being mirrored; for {@link OrderKind#CLOSE_POSITION} it is the slave
 * position to close and {@code volume} is the amount to close.
 */
@Value
@Builder(toBuilder = true)
public class OrderRequest {

    public static final String LABEL_PREFIX = "copy:";

    long accountId;
    long instrumentId;
    PositionSide side;
    BigDecimal volume;
    long linkedPositionId;
    String label;
    int attemptNo;
    OrderKind kind;

    public static String labelFor(long masterPositionId) {
        return LABEL_PREFIX + masterPositionId;
    }
}
