package com.tradecopier.unit.oms;

import static com.tradecopier.support.CopierTestContext.EURUSD_MASTER;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.DecisionReason;
import com.tradecopier.domain.enums.PositionSide;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.support.CopierTestContext;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Drives the dispatcher with the production trading limiter settings and checks the spacing of
 * requests as they reach the channel.
 */
class OrderDispatcherRateLimitTest {

    private static final int ORDERS = 60;
    private static final int WINDOW = 50;

    @Test
    @DisplayName("Fifty-one consecutive trading requests span close to a full second")
    void fiftyPerRollingSecond() {
        RateLimiterRegistry rateLimiterRegistry = RateLimiterRegistry.of(RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMillis(20))
                .timeoutDuration(Duration.ofSeconds(30))
                .build());
        CopierTestContext context =
                new CopierTestContext(CopierTestContext.defaultProperties(), rateLimiterRegistry);

        for (long masterPositionId = 1; masterPositionId <= ORDERS; masterPositionId++) {
            context.getOrderDispatcher().dispatch(CopyDecision.builder()
                    .action(CopyAction.OPEN)
                    .instrumentId(EURUSD_MASTER)
                    .masterPositionId(masterPositionId)
                    .side(PositionSide.LONG)
                    .masterVolume(new BigDecimal("0.10"))
                    .requestedSlaveVolume(new BigDecimal("0.05"))
                    .reason(DecisionReason.NEW_POSITION)
                    .build());
        }

        List<Long> requestNanos = context.getTradingChannel().getRequestNanos();
        assertThat(requestNanos).hasSize(ORDERS);
        assertThat(context.getPositionLedger().size()).isEqualTo(ORDERS);
        // Request i+50 cannot start before fifty more 20 ms cycles have begun
        for (int i = 0; i + WINDOW < requestNanos.size(); i++) {
            long spacingMillis = TimeUnit.NANOSECONDS.toMillis(requestNanos.get(i + WINDOW) - requestNanos.get(i));
            assertThat(spacingMillis).as("requests %d..%d", i, i + WINDOW).isGreaterThanOrEqualTo(900L);
        }
    }
}
