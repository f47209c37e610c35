package com.tradecopier.sizing;

import com.tradecopier.domain.model.AccountSnapshot;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Input to one {@link VolumePolicy} evaluation. {@code symbolName} is the configured name of the
 * master instrument, used to look up per-instrument tables; null for unmapped instruments.
 */
@Value
@Builder
public class VolumeContext {

    long instrumentId;
    String symbolName;
    BigDecimal masterVolume;
    AccountSnapshot accountSnapshot;
}
