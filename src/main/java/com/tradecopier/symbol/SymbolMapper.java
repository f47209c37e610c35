package com.tradecopier.symbol;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.config.CopierProperties.SymbolMapping;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.exception.InstrumentNotMappedException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Resolves instrument ids between the master and slave catalogs.
 *
 * <p>The same symbol usually has different ids at different brokers (EURUSD may be 1 on the
 * master and 41 on the slave). The table is the configured {@code copier.symbols} list; it is
 * immutable after construction, so lookups need no synchronization.
 */
@Component
public class SymbolMapper {

    private final Map<Long, SymbolMapping> byMasterId = new HashMap<>();
    private final Map<Long, SymbolMapping> bySlaveId = new HashMap<>();
    private final Map<String, SymbolMapping> byName = new HashMap<>();

    public SymbolMapper(CopierProperties copierProperties) {
        for (SymbolMapping mapping : copierProperties.getSymbols()) {
            if (byMasterId.putIfAbsent(mapping.getMasterId(), mapping) != null) {
                throw new IllegalStateException("Master symbol id configured twice: " + mapping.getMasterId());
            }
            if (bySlaveId.putIfAbsent(mapping.getSlaveId(), mapping) != null) {
                throw new IllegalStateException("Slave symbol id configured twice: " + mapping.getSlaveId());
            }
            byName.put(mapping.getName().toUpperCase(), mapping);
        }
    }

    /**
     * Translates an instrument id from the source account's catalog into the target's.
     *
     * @throws InstrumentNotMappedException if the instrument is not in the configured table
     */
    public long resolve(long instrumentId, AccountRole source, AccountRole target) {
        if (source == target) {
            if (!table(source).containsKey(instrumentId)) {
                throw new InstrumentNotMappedException(instrumentId, source, target);
            }
            return instrumentId;
        }
        SymbolMapping mapping = table(source).get(instrumentId);
        if (mapping == null) {
            throw new InstrumentNotMappedException(instrumentId, source, target);
        }
        return target == AccountRole.MASTER ? mapping.getMasterId() : mapping.getSlaveId();
    }

    public boolean isMapped(long instrumentId, AccountRole role) {
        return table(role).containsKey(instrumentId);
    }

    /** Symbol name for an instrument id in the given account's catalog. */
    public Optional<String> nameOf(long instrumentId, AccountRole role) {
        return Optional.ofNullable(table(role).get(instrumentId)).map(SymbolMapping::getName);
    }

    public Optional<Long> idOf(String symbolName, AccountRole role) {
        SymbolMapping mapping = byName.get(symbolName.toUpperCase());
        if (mapping == null) {
            return Optional.empty();
        }
        return Optional.of(role == AccountRole.MASTER ? mapping.getMasterId() : mapping.getSlaveId());
    }

    /** All configured instrument ids in the given account's catalog. */
    public List<Long> instrumentIds(AccountRole role) {
        return table(role).keySet().stream().sorted().toList();
    }

    private Map<Long, SymbolMapping> table(AccountRole role) {
        return role == AccountRole.MASTER ? byMasterId : bySlaveId;
    }
}
