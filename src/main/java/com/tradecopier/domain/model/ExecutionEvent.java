package com.tradecopier.domain.model;

import com.tradecopier.domain.enums.ExecutionEventKind;
import com.tradecopier.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized execution notification from the master account.
 *
 * <p>{@code volumeDelta} is the volume the underlying deal moved (always non-negative);
 * {@code resultingMasterVolume} is the master position's volume after the deal, zero when it
 * closed the position. Both are in lots.
 *
 * <p>{@code sequenceNo} is the venue's deal id when the notification carries a deal
 * ({@code dealSequenced}), otherwise the transport's arrival counter for the current connection
 * epoch. Only deal ids are compared against the sequence tracker.
 */
@Value
@Builder
public class ExecutionEvent {

    long masterPositionId;
    long instrumentId;
    ExecutionEventKind kind;
    PositionSide side;
    BigDecimal volumeDelta;
    BigDecimal resultingMasterVolume;
    Instant timestamp;
    long sequenceNo;
    boolean dealSequenced;
}
