package com.tradecopier.symbol;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.domain.model.SpotQuote;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Money value of a one-pip move on one lot, per account.
 *
 * <p>Pip size is {@code 10^-pipPosition}. When the instrument's quote asset is the account's
 * deposit asset the value is {@code pipSize * units per lot}; otherwise it is converted through
 * the latest mid price: {@code pipSize / mid * units per lot}.
 *
 * <p>A calibrated contract size from {@code copier.volume.contract-sizes} takes precedence over
 * the catalog-derived value. Brokers quoting the same symbol with different contract sizes are
 * only equalized correctly with calibration.
 */
@Component
public class PipValueCalculator {

    private static final Logger log = LoggerFactory.getLogger(PipValueCalculator.class);

    private static final BigDecimal PROTOCOL_UNITS_PER_UNIT = BigDecimal.valueOf(100);

    private final SymbolCatalog symbolCatalog;
    private final SymbolMapper symbolMapper;
    private final CopierProperties copierProperties;

    public PipValueCalculator(
            SymbolCatalog symbolCatalog, SymbolMapper symbolMapper, CopierProperties copierProperties) {
        this.symbolCatalog = symbolCatalog;
        this.symbolMapper = symbolMapper;
        this.copierProperties = copierProperties;
    }

    /**
     * Pip value per lot of an instrument in the given account's catalog, empty when the
     * specification, deposit asset or (for cross conversion) the spot price is not known yet.
     */
    public Optional<BigDecimal> pipValue(AccountRole role, long instrumentId) {
        Optional<BigDecimal> calibrated = calibratedContractSize(role, instrumentId);
        if (calibrated.isPresent()) {
            return calibrated;
        }

        Optional<InstrumentSpec> spec = symbolCatalog.findSpec(role, instrumentId);
        Optional<String> depositAsset = symbolCatalog.depositAsset(role);
        if (spec.isEmpty() || depositAsset.isEmpty()) {
            log.debug("No spec or deposit asset yet for {} instrument {}", role, instrumentId);
            return Optional.empty();
        }

        InstrumentSpec instrumentSpec = spec.get();
        BigDecimal pipSize = BigDecimal.ONE.movePointLeft(instrumentSpec.getPipPosition());
        BigDecimal unitsPerLot =
                BigDecimal.valueOf(instrumentSpec.getLotSize()).divide(PROTOCOL_UNITS_PER_UNIT, MathContext.DECIMAL64);

        if (depositAsset.get().equalsIgnoreCase(instrumentSpec.getQuoteAsset())) {
            return Optional.of(pipSize.multiply(unitsPerLot));
        }

        Optional<BigDecimal> mid = symbolCatalog.findSpot(role, instrumentId).map(SpotQuote::getMid);
        if (mid.isEmpty() || mid.get().signum() <= 0) {
            log.debug("No spot price yet for {} instrument {}", role, instrumentId);
            return Optional.empty();
        }
        return Optional.of(pipSize.divide(mid.get(), MathContext.DECIMAL64).multiply(unitsPerLot));
    }

    private Optional<BigDecimal> calibratedContractSize(AccountRole role, long instrumentId) {
        return symbolMapper
                .nameOf(instrumentId, role)
                .map(name -> copierProperties.getVolume().getContractSizes().get(name))
                .map(size -> role == AccountRole.MASTER ? size.getMaster() : size.getSlave());
    }
}
