package com.tradecopier.sizing.impl;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.sizing.VolumeContext;
import com.tradecopier.sizing.VolumePolicy;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * {@code masterVolume * globalMultiplier}. Also the fallback for every other policy; without a
 * configured global multiplier the default multiplier is used.
 */
@Component
public class GlobalMultiplierPolicy implements VolumePolicy {

    private final CopierProperties.Volume volumeConfig;

    public GlobalMultiplierPolicy(CopierProperties copierProperties) {
        this.volumeConfig = copierProperties.getVolume();
    }

    @Override
    public Optional<BigDecimal> rawVolume(VolumeContext volumeContext) {
        return Optional.of(volumeContext.getMasterVolume().multiply(multiplier()));
    }

    public BigDecimal multiplier() {
        return volumeConfig.getGlobalMultiplier() != null
                ? volumeConfig.getGlobalMultiplier()
                : volumeConfig.getDefaultMultiplier();
    }

    @Override
    public boolean isConfigured() {
        return volumeConfig.getGlobalMultiplier() != null;
    }

    @Override
    public VolumePolicyType getType() {
        return VolumePolicyType.GLOBAL_MULTIPLIER;
    }
}
