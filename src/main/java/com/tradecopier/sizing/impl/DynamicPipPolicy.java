package com.tradecopier.sizing.impl;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.domain.model.AccountSnapshot;
import com.tradecopier.sizing.VolumeContext;
import com.tradecopier.sizing.VolumePolicy;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Equalizes the money at risk per pip between the two accounts:
 * {@code masterVolume * masterPipValue / slavePipValue * dynamicPipVolumeRatio}.
 *
 * <p>If the slave's pip is worth five times the master's, the slave trades a fifth of the
 * volume (times the ratio). Missing pip values on either side yield empty.
 */
@Component
public class DynamicPipPolicy implements VolumePolicy {

    private final CopierProperties.Volume volumeConfig;

    public DynamicPipPolicy(CopierProperties copierProperties) {
        this.volumeConfig = copierProperties.getVolume();
    }

    @Override
    public Optional<BigDecimal> rawVolume(VolumeContext volumeContext) {
        AccountSnapshot snapshot = volumeContext.getAccountSnapshot();
        if (snapshot == null
                || snapshot.getMasterPipValue() == null
                || snapshot.getSlavePipValue() == null
                || snapshot.getSlavePipValue().signum() <= 0) {
            return Optional.empty();
        }

        BigDecimal ratio = volumeConfig.getDynamicPipVolumeRatio() != null
                ? volumeConfig.getDynamicPipVolumeRatio()
                : BigDecimal.ONE;
        return Optional.of(volumeContext
                .getMasterVolume()
                .multiply(snapshot.getMasterPipValue())
                .divide(snapshot.getSlavePipValue(), MathContext.DECIMAL64)
                .multiply(ratio));
    }

    @Override
    public boolean isConfigured() {
        return volumeConfig.getDynamicPipVolumeRatio() != null;
    }

    @Override
    public VolumePolicyType getType() {
        return VolumePolicyType.DYNAMIC_PIP;
    }
}
