package com.tradecopier.sizing;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.domain.model.AccountSnapshot;
import com.tradecopier.session.TradingChannel;
import com.tradecopier.symbol.PipValueCalculator;
import com.tradecopier.symbol.SymbolMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collects the account-dependent inputs a volume policy needs, and only those.
 *
 * <p>BALANCE_PERCENTAGE queries the slave balance through the {@code dataQueries} rate limiter;
 * DYNAMIC_PIP reads pip values from the symbol catalog. Any input that cannot be obtained is
 * left null so the calculator falls back to the global multiplier instead of failing the copy.
 */
@Service
public class AccountSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(AccountSnapshotService.class);

    static final String DATA_QUERIES = "dataQueries";

    private final TradingChannel tradingChannel;
    private final PipValueCalculator pipValueCalculator;
    private final SymbolMapper symbolMapper;
    private final RateLimiter dataQueriesLimiter;
    private final Duration requestTimeout;

    public AccountSnapshotService(
            TradingChannel tradingChannel,
            PipValueCalculator pipValueCalculator,
            SymbolMapper symbolMapper,
            RateLimiterRegistry rateLimiterRegistry,
            CopierProperties copierProperties) {
        this.tradingChannel = tradingChannel;
        this.pipValueCalculator = pipValueCalculator;
        this.symbolMapper = symbolMapper;
        this.dataQueriesLimiter = rateLimiterRegistry.rateLimiter(DATA_QUERIES);
        this.requestTimeout = copierProperties.getTransport().getRequestTimeout();
    }

    public AccountSnapshot snapshotFor(long masterInstrumentId, VolumePolicyType policyType) {
        return switch (policyType) {
            case BALANCE_PERCENTAGE -> AccountSnapshot.builder()
                    .slaveBalance(slaveBalance())
                    .build();
            case DYNAMIC_PIP -> pipSnapshot(masterInstrumentId);
            case GLOBAL_MULTIPLIER, PER_INSTRUMENT -> AccountSnapshot.EMPTY;
        };
    }

    private AccountSnapshot pipSnapshot(long masterInstrumentId) {
        if (!symbolMapper.isMapped(masterInstrumentId, AccountRole.MASTER)) {
            return AccountSnapshot.EMPTY;
        }
        long slaveInstrumentId = symbolMapper.resolve(masterInstrumentId, AccountRole.MASTER, AccountRole.SLAVE);
        return AccountSnapshot.builder()
                .masterPipValue(pipValueCalculator
                        .pipValue(AccountRole.MASTER, masterInstrumentId)
                        .orElse(null))
                .slavePipValue(pipValueCalculator
                        .pipValue(AccountRole.SLAVE, slaveInstrumentId)
                        .orElse(null))
                .build();
    }

    private BigDecimal slaveBalance() {
        try {
            RateLimiter.waitForPermission(dataQueriesLimiter);
            return tradingChannel
                    .queryBalance(AccountRole.SLAVE)
                    .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while querying slave balance");
            return null;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("Slave balance unavailable, sizing will fall back: {}", e.toString());
            return null;
        }
    }
}
