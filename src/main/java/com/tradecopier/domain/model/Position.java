package com.tradecopier.domain.model;

import com.tradecopier.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One master position paired with its slave replica, as held by the
 * {@link com.tradecopier.ledger.PositionLedger}.
 *
 * <p>Volumes are in lots. Created on a confirmed OPEN, volumes are reduced in place on a
 * confirmed partial close, and the row is removed on a confirmed full close. Callers outside the
 * ledger only ever see copies (see {@link #copy()}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    /** Instrument id in the master account's catalog. */
    private long instrumentId;

    /** Instrument id in the slave account's catalog. */
    private long slaveInstrumentId;

    private long masterPositionId;

    /** Null until the slave order has been confirmed. */
    private Long slavePositionId;

    private PositionSide side;

    private BigDecimal masterVolume;

    private BigDecimal slaveVolume;

    private Instant openedAt;

    public Position copy() {
        return toBuilder().build();
    }
}
