package com.tradecopier.sizing;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.domain.model.AccountSnapshot;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.sizing.impl.GlobalMultiplierPolicy;
import com.tradecopier.symbol.SymbolCatalog;
import com.tradecopier.symbol.SymbolMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Computes the slave volume for a new copied position.
 *
 * <p>The raw volume comes from the selected {@link VolumePolicy}. A policy that lacks its inputs
 * (no balance, no pip values) falls back to the global multiplier and the result is flagged
 * {@link VolumeResult#isFallbackApplied()}. Every raw volume is then post-processed, in order:
 * <ol>
 *   <li>raised to {@code min-lot-size},</li>
 *   <li>capped at {@code max-lot-multiplier * masterVolume},</li>
 *   <li>rounded half-up to the slave instrument's lot step,</li>
 *   <li>raised to one lot step if rounding produced zero.</li>
 * </ol>
 * Post-processing an already post-processed volume returns it unchanged.
 *
 * <p>Only OPEN decisions are sized here. Partial closes scale the existing slave volume instead
 * (see {@link #scaleToStep(BigDecimal, BigDecimal, BigDecimal, BigDecimal)}).
 */
@Service
public class VolumeCalculator {

    private final VolumePolicyFactory volumePolicyFactory;
    private final GlobalMultiplierPolicy globalMultiplierPolicy;
    private final SymbolMapper symbolMapper;
    private final SymbolCatalog symbolCatalog;
    private final CopierProperties.Volume volumeConfig;
    private final CopyLogger copyLogger;

    public VolumeCalculator(
            VolumePolicyFactory volumePolicyFactory,
            GlobalMultiplierPolicy globalMultiplierPolicy,
            SymbolMapper symbolMapper,
            SymbolCatalog symbolCatalog,
            CopierProperties copierProperties,
            CopyLogger copyLogger) {
        this.volumePolicyFactory = volumePolicyFactory;
        this.globalMultiplierPolicy = globalMultiplierPolicy;
        this.symbolMapper = symbolMapper;
        this.symbolCatalog = symbolCatalog;
        this.volumeConfig = copierProperties.getVolume();
        this.copyLogger = copyLogger;
    }

    /** The policy in effect: {@code copier.volume.policy} if set, else precedence order. */
    public VolumePolicyType activePolicy() {
        return volumePolicyFactory.resolveActive(volumeConfig.getPolicy());
    }

    public VolumeResult compute(long instrumentId, BigDecimal masterVolume, AccountSnapshot accountSnapshot) {
        return compute(instrumentId, masterVolume, activePolicy(), accountSnapshot);
    }

    /**
     * Sizes a master volume for the slave account.
     *
     * @param instrumentId instrument id in the master catalog
     * @param masterVolume master volume in lots, positive
     * @param policyType policy to evaluate
     * @param accountSnapshot balance and pip values; fields the policy does not need may be null
     */
    public VolumeResult compute(
            long instrumentId, BigDecimal masterVolume, VolumePolicyType policyType, AccountSnapshot accountSnapshot) {
        VolumeContext volumeContext = VolumeContext.builder()
                .instrumentId(instrumentId)
                .symbolName(symbolMapper.nameOf(instrumentId, AccountRole.MASTER).orElse(null))
                .masterVolume(masterVolume)
                .accountSnapshot(accountSnapshot != null ? accountSnapshot : AccountSnapshot.EMPTY)
                .build();

        Optional<BigDecimal> policyVolume =
                volumePolicyFactory.getPolicy(policyType).rawVolume(volumeContext);
        boolean fallbackApplied = policyVolume.isEmpty();
        BigDecimal rawVolume = policyVolume.orElseGet(() -> globalMultiplierPolicy
                .rawVolume(volumeContext)
                .orElseThrow());
        if (fallbackApplied) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("policy", policyType);
            values.put("fallbackMultiplier", globalMultiplierPolicy.multiplier());
            values.put("masterVolume", masterVolume);
            copyLogger.logVolumeWarning(instrumentId, "Policy inputs missing, using global multiplier", values);
        }

        BigDecimal lotStep = lotStep(instrumentId);
        BigDecimal volume = rawVolume;
        boolean raisedToMinimum = false;
        boolean cappedAtMaximum = false;
        boolean raisedToOneStep = false;

        if (volume.compareTo(volumeConfig.getMinLotSize()) < 0) {
            logClamp(instrumentId, "Raised to minimum lot size", volume, volumeConfig.getMinLotSize());
            volume = volumeConfig.getMinLotSize();
            raisedToMinimum = true;
        }

        BigDecimal maxVolume = masterVolume.multiply(volumeConfig.getMaxLotMultiplier());
        if (volume.compareTo(maxVolume) > 0) {
            logClamp(instrumentId, "Capped at max lot multiplier", volume, maxVolume);
            volume = maxVolume;
            cappedAtMaximum = true;
        }

        volume = roundToStep(volume, lotStep);
        if (volume.signum() == 0) {
            volume = lotStep;
            raisedToOneStep = true;
        }

        return VolumeResult.builder()
                .volume(volume)
                .rawVolume(rawVolume)
                .policy(policyType)
                .fallbackApplied(fallbackApplied)
                .raisedToMinimum(raisedToMinimum)
                .cappedAtMaximum(cappedAtMaximum)
                .raisedToOneStep(raisedToOneStep)
                .build();
    }

    /**
     * Applies only the post-processing steps to a volume. Exposed so the clamp chain can be
     * checked on its own.
     */
    public BigDecimal postProcess(long instrumentId, BigDecimal volume, BigDecimal masterVolume) {
        BigDecimal lotStep = lotStep(instrumentId);
        BigDecimal result = volume.max(volumeConfig.getMinLotSize());
        result = result.min(masterVolume.multiply(volumeConfig.getMaxLotMultiplier()));
        result = roundToStep(result, lotStep);
        return result.signum() == 0 ? lotStep : result;
    }

    /** Lot step of the slave instrument paired with a master instrument. */
    public BigDecimal lotStep(long masterInstrumentId) {
        if (!symbolMapper.isMapped(masterInstrumentId, AccountRole.MASTER)) {
            return volumeConfig.getDefaultLotStep();
        }
        long slaveInstrumentId = symbolMapper.resolve(masterInstrumentId, AccountRole.MASTER, AccountRole.SLAVE);
        return symbolCatalog
                .findSpec(AccountRole.SLAVE, slaveInstrumentId)
                .map(InstrumentSpec::getStepVolume)
                .filter(step -> step.signum() > 0)
                .orElse(volumeConfig.getDefaultLotStep());
    }

    /** Rounds half-up to a multiple of {@code lotStep}. */
    public static BigDecimal roundToStep(BigDecimal volume, BigDecimal lotStep) {
        BigDecimal steps = volume.divide(lotStep, 0, RoundingMode.HALF_UP);
        return steps.multiply(lotStep).setScale(lotStep.scale(), RoundingMode.UNNECESSARY);
    }

    /**
     * Proportional remainder for a partial close:
     * {@code masterAfter / masterBefore * slaveBefore}, rounded half-up to the lot step and never
     * below one step.
     */
    public static BigDecimal scaleToStep(
            BigDecimal masterAfter, BigDecimal masterBefore, BigDecimal slaveBefore, BigDecimal lotStep) {
        BigDecimal scaled = masterAfter
                .multiply(slaveBefore)
                .divide(masterBefore, lotStep.scale() + 8, RoundingMode.HALF_UP);
        BigDecimal rounded = roundToStep(scaled, lotStep);
        return rounded.compareTo(lotStep) < 0 ? lotStep : rounded;
    }

    private void logClamp(long instrumentId, String message, BigDecimal from, BigDecimal to) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("from", from);
        values.put("to", to);
        copyLogger.logVolume(instrumentId, message, values);
    }
}
