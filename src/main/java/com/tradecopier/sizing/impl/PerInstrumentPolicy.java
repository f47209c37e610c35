package com.tradecopier.sizing.impl;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.sizing.VolumeContext;
import com.tradecopier.sizing.VolumePolicy;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * {@code masterVolume * multiplier(symbol)}, with {@code default-multiplier} for symbols not in
 * the table.
 */
@Component
public class PerInstrumentPolicy implements VolumePolicy {

    private final CopierProperties.Volume volumeConfig;

    public PerInstrumentPolicy(CopierProperties copierProperties) {
        this.volumeConfig = copierProperties.getVolume();
    }

    @Override
    public Optional<BigDecimal> rawVolume(VolumeContext volumeContext) {
        BigDecimal multiplier = volumeContext.getSymbolName() != null
                ? volumeConfig.getPerInstrument().get(volumeContext.getSymbolName())
                : null;
        if (multiplier == null) {
            multiplier = volumeConfig.getDefaultMultiplier();
        }
        return Optional.of(volumeContext.getMasterVolume().multiply(multiplier));
    }

    @Override
    public boolean isConfigured() {
        return !volumeConfig.getPerInstrument().isEmpty();
    }

    @Override
    public VolumePolicyType getType() {
        return VolumePolicyType.PER_INSTRUMENT;
    }
}
