package com.tradecopier.sizing;

import com.tradecopier.domain.enums.VolumePolicyType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Slave volume computed by {@link VolumeCalculator}, with what happened on the way.
 *
 * <p>{@code fallbackApplied} marks a policy that lacked its inputs and was replaced by the global
 * multiplier. It is a warning, never an error.
 */
@Value
@Builder
public class VolumeResult {

    BigDecimal volume;
    BigDecimal rawVolume;
    VolumePolicyType policy;
    boolean fallbackApplied;
    boolean raisedToMinimum;
    boolean cappedAtMaximum;
    boolean raisedToOneStep;
}
