package com.tradecopier.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Account-dependent inputs to volume sizing. Every field is optional; policies that need a
 * missing field fall back to the global multiplier.
 */
@Value
@Builder
public class AccountSnapshot {

    public static final AccountSnapshot EMPTY = AccountSnapshot.builder().build();

    BigDecimal slaveBalance;

    /** Money value of one pip per lot on the master instrument, in the master deposit currency. */
    BigDecimal masterPipValue;

    /** Money value of one pip per lot on the slave instrument, in the slave deposit currency. */
    BigDecimal slavePipValue;
}
