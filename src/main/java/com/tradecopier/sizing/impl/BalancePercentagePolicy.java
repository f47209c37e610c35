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
 * Sizes from the slave balance, ignoring the master volume.
 *
 * <p>{@code riskAmount = slaveBalance * lotPercentage}, then
 * {@code lots = riskAmount * microLotsPerDollar(symbol) / 100} (one lot is 100 micro-lots).
 * With a 1000 balance, 2% and 10 micro-lots per dollar this trades 2 lots.
 */
@Component
public class BalancePercentagePolicy implements VolumePolicy {

    private static final BigDecimal MICRO_LOTS_PER_LOT = BigDecimal.valueOf(100);

    private final CopierProperties.Volume volumeConfig;

    public BalancePercentagePolicy(CopierProperties copierProperties) {
        this.volumeConfig = copierProperties.getVolume();
    }

    @Override
    public Optional<BigDecimal> rawVolume(VolumeContext volumeContext) {
        AccountSnapshot snapshot = volumeContext.getAccountSnapshot();
        if (snapshot == null || snapshot.getSlaveBalance() == null || volumeConfig.getLotPercentage() == null) {
            return Optional.empty();
        }

        BigDecimal riskAmount = snapshot.getSlaveBalance().multiply(volumeConfig.getLotPercentage());
        BigDecimal microLotsPerDollar = volumeContext.getSymbolName() != null
                ? volumeConfig.getMicroLotsPerDollar().get(volumeContext.getSymbolName())
                : null;
        if (microLotsPerDollar == null) {
            microLotsPerDollar = volumeConfig.getDefaultMicroLotsPerDollar();
        }
        return Optional.of(riskAmount.multiply(microLotsPerDollar).divide(MICRO_LOTS_PER_LOT, MathContext.DECIMAL64));
    }

    @Override
    public boolean isConfigured() {
        return volumeConfig.getLotPercentage() != null;
    }

    @Override
    public VolumePolicyType getType() {
        return VolumePolicyType.BALANCE_PERCENTAGE;
    }
}
