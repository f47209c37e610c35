package com.tradecopier.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Balance (already divided by 10^moneyDigits) and deposit asset name of a trader account. */
@Value
@Builder
public class TraderInfo {

    long accountId;
    BigDecimal balance;
    String depositAsset;
}
