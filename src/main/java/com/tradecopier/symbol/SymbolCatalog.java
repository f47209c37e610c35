package com.tradecopier.symbol;

import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.domain.model.SpotQuote;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-account instrument specifications, deposit assets and latest spot prices.
 *
 * <p>Written by the Session Coordinator while it brings a session up and by the transport's spot
 * listener; read concurrently by the copy lanes. Specifications are reloaded on every session,
 * spots are overwritten on every tick.
 */
@Component
public class SymbolCatalog {

    private static final Logger log = LoggerFactory.getLogger(SymbolCatalog.class);

    private final Map<AccountRole, Map<Long, InstrumentSpec>> specs = new EnumMap<>(AccountRole.class);
    private final Map<AccountRole, Map<Long, SpotQuote>> spots = new EnumMap<>(AccountRole.class);
    private final Map<AccountRole, String> depositAssets = new ConcurrentHashMap<>();

    public SymbolCatalog() {
        for (AccountRole role : AccountRole.values()) {
            specs.put(role, new ConcurrentHashMap<>());
            spots.put(role, new ConcurrentHashMap<>());
        }
    }

    public void registerSpecs(AccountRole role, Collection<InstrumentSpec> instrumentSpecs) {
        Map<Long, InstrumentSpec> table = specs.get(role);
        for (InstrumentSpec spec : instrumentSpecs) {
            table.put(spec.getInstrumentId(), spec);
        }
        log.info("Loaded {} instrument specs for {} account", instrumentSpecs.size(), role);
    }

    public Optional<InstrumentSpec> findSpec(AccountRole role, long instrumentId) {
        return Optional.ofNullable(specs.get(role).get(instrumentId));
    }

    public void updateSpot(AccountRole role, SpotQuote quote) {
        spots.get(role).merge(quote.getInstrumentId(), quote, SymbolCatalog::mergeQuote);
    }

    public Optional<SpotQuote> findSpot(AccountRole role, long instrumentId) {
        return Optional.ofNullable(spots.get(role).get(instrumentId));
    }

    public void setDepositAsset(AccountRole role, String asset) {
        if (asset != null) {
            depositAssets.put(role, asset);
        }
    }

    public Optional<String> depositAsset(AccountRole role) {
        return Optional.ofNullable(depositAssets.get(role));
    }

    /** Drops everything loaded for the previous session. */
    public void clear() {
        specs.values().forEach(Map::clear);
        spots.values().forEach(Map::clear);
        depositAssets.clear();
    }

    // Spot events may carry only one side of the book; keep the other side from the last tick.
    private static SpotQuote mergeQuote(SpotQuote previous, SpotQuote latest) {
        return new SpotQuote(
                latest.getInstrumentId(),
                latest.getBid() != null ? latest.getBid() : previous.getBid(),
                latest.getAsk() != null ? latest.getAsk() : previous.getAsk(),
                latest.getReceivedAt());
    }
}
