package com.tradecopier.domain.model;

import com.tradecopier.domain.enums.OrderErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Result of dispatching one copy decision. {@code slavePositionId} is set on accepted orders
 * that opened or touched a slave position.
 */
@Value
@Builder
public class OrderOutcome {

    boolean accepted;
    Long slavePositionId;
    OrderErrorKind errorKind;
    String message;

    public static OrderOutcome accepted(Long slavePositionId) {
        return OrderOutcome.builder()
                .accepted(true)
                .slavePositionId(slavePositionId)
                .errorKind(OrderErrorKind.NONE)
                .build();
    }

    public static OrderOutcome failed(OrderErrorKind errorKind, String message) {
        return OrderOutcome.builder()
                .accepted(false)
                .errorKind(errorKind)
                .message(message)
                .build();
    }
}
