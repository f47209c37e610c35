package com.tradecopier.oms;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.OrderErrorKind;
import com.tradecopier.domain.enums.OrderKind;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.domain.model.Position;
import com.tradecopier.event.ReconciliationRequestedEvent;
import com.tradecopier.exception.AuthException;
import com.tradecopier.exception.DuplicatePositionException;
import com.tradecopier.exception.InstrumentNotMappedException;
import com.tradecopier.exception.PositionNotFoundException;
import com.tradecopier.exception.RejectedOrderException;
import com.tradecopier.exception.TransportException;
import com.tradecopier.exception.VenueRateLimitException;
import com.tradecopier.ledger.PositionLedger;
import com.tradecopier.observability.CopierMetricsService;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.session.TradingChannel;
import com.tradecopier.symbol.SymbolMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Executes copy decisions against the slave account and records confirmed results in the
 * {@link PositionLedger}.
 *
 * <p>Every outbound request passes through two Resilience4j decorators:
 * <ul>
 *   <li>{@code tradingOrders} {@link RateLimiter}: one permit every 20 ms, so no rolling second
 *       carries more than 50 trading requests. Callers wait for a permit, which keeps each
 *       lane's submission order;</li>
 *   <li>{@code tradingOrders} {@link Retry}: exponential backoff on {@link TransportException}
 *       only. Rejections and auth failures surface on the first attempt.</li>
 * </ul>
 * Each retry attempt takes its own permit.
 *
 * <p>The ledger changes only after the venue confirms. A decision for a position the ledger does
 * not hold ends as NOT_FOUND and asks for an out-of-band reconciliation. Nothing thrown here
 * escapes {@link #dispatch(CopyDecision)}: every failure becomes an {@link OrderOutcome}.
 */
@Service
public class OrderDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OrderDispatcher.class);

    static final String TRADING_ORDERS = "tradingOrders";

    private final TradingChannel tradingChannel;
    private final PositionLedger positionLedger;
    private final SymbolMapper symbolMapper;
    private final CopyLogger copyLogger;
    private final CopierMetricsService copierMetricsService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RateLimiter tradingOrdersLimiter;
    private final Retry tradingOrdersRetry;
    private final Duration responseTimeout;

    public OrderDispatcher(
            TradingChannel tradingChannel,
            PositionLedger positionLedger,
            SymbolMapper symbolMapper,
            CopyLogger copyLogger,
            CopierMetricsService copierMetricsService,
            ApplicationEventPublisher applicationEventPublisher,
            RateLimiterRegistry rateLimiterRegistry,
            RetryRegistry retryRegistry,
            CopierProperties copierProperties) {
        this.tradingChannel = tradingChannel;
        this.positionLedger = positionLedger;
        this.symbolMapper = symbolMapper;
        this.copyLogger = copyLogger;
        this.copierMetricsService = copierMetricsService;
        this.applicationEventPublisher = applicationEventPublisher;
        this.tradingOrdersLimiter = rateLimiterRegistry.rateLimiter(TRADING_ORDERS);
        this.tradingOrdersRetry = retryRegistry.retry(TRADING_ORDERS);
        // The channel times requests out itself; this only guards against a lost completion.
        this.responseTimeout = copierProperties.getTransport().getRequestTimeout().multipliedBy(2);
    }

    public OrderOutcome dispatch(CopyDecision decision) {
        OrderOutcome outcome = switch (decision.getAction()) {
            case OPEN -> dispatchOpen(decision);
            case CLOSE -> dispatchClose(decision);
            case ADJUST -> dispatchAdjust(decision);
            case SKIP -> OrderOutcome.failed(OrderErrorKind.NOT_DISPATCHED, String.valueOf(decision.getReason()));
        };
        if (decision.getAction() != CopyAction.SKIP) {
            copierMetricsService.recordOutcome(outcome);
        }
        return outcome;
    }

    private OrderOutcome dispatchOpen(CopyDecision decision) {
        long masterPositionId = decision.getMasterPositionId();
        BigDecimal slaveVolume = decision.getRequestedSlaveVolume();
        if (slaveVolume == null || slaveVolume.signum() <= 0) {
            copyLogger.logError(decision, "OPEN without a sized slave volume");
            return OrderOutcome.failed(OrderErrorKind.NOT_DISPATCHED, "slave volume not computed");
        }
        if (positionLedger.contains(masterPositionId)) {
            copyLogger.logError(decision, "OPEN for a position already in the ledger, skipped");
            return OrderOutcome.failed(OrderErrorKind.DUPLICATE_KEY, "position already copied");
        }

        long slaveInstrumentId;
        try {
            slaveInstrumentId = symbolMapper.resolve(decision.getInstrumentId(), AccountRole.MASTER, AccountRole.SLAVE);
        } catch (InstrumentNotMappedException e) {
            copyLogger.logError(decision, e.getMessage());
            return OrderOutcome.failed(OrderErrorKind.REJECTED, e.getMessage());
        }

        OrderRequest orderRequest = OrderRequest.builder()
                .accountId(tradingChannel.accountId(AccountRole.SLAVE))
                .instrumentId(slaveInstrumentId)
                .side(decision.getSide())
                .volume(slaveVolume)
                .linkedPositionId(masterPositionId)
                .label(OrderRequest.labelFor(masterPositionId))
                .kind(OrderKind.MARKET_OPEN)
                .build();

        OrderOutcome outcome = execute(decision, orderRequest, tradingChannel::sendOrder);
        if (!outcome.isAccepted()) {
            return outcome;
        }

        try {
            positionLedger.upsertOpen(Position.builder()
                    .instrumentId(decision.getInstrumentId())
                    .slaveInstrumentId(slaveInstrumentId)
                    .masterPositionId(masterPositionId)
                    .slavePositionId(outcome.getSlavePositionId())
                    .side(decision.getSide())
                    .masterVolume(decision.getMasterVolume())
                    .slaveVolume(slaveVolume)
                    .openedAt(Instant.now())
                    .build());
        } catch (DuplicatePositionException e) {
            copyLogger.logError(decision, "Slave position " + outcome.getSlavePositionId()
                    + " opened but the master position was paired concurrently");
            return OrderOutcome.failed(OrderErrorKind.DUPLICATE_KEY, e.getMessage());
        }
        copyLogger.logOpen(decision, outcome.getSlavePositionId(), slaveVolume);
        return outcome;
    }

    private OrderOutcome dispatchClose(CopyDecision decision) {
        Optional<Position> recorded = positionLedger.find(decision.getMasterPositionId());
        if (recorded.isEmpty()) {
            return notFound(decision);
        }
        Position position = recorded.get();

        OrderRequest orderRequest = closeRequest(position, position.getSlaveVolume());
        OrderOutcome outcome = execute(decision, orderRequest, tradingChannel::closePosition);
        if (!outcome.isAccepted()) {
            return outcome;
        }

        try {
            positionLedger.remove(position.getMasterPositionId());
        } catch (PositionNotFoundException e) {
            log.warn("Position {} left the ledger while its close was in flight", position.getMasterPositionId());
        }
        copyLogger.logClose(decision, position.getSlavePositionId(), position.getSlaveVolume());
        return OrderOutcome.accepted(position.getSlavePositionId());
    }

    private OrderOutcome dispatchAdjust(CopyDecision decision) {
        Optional<Position> recorded = positionLedger.find(decision.getMasterPositionId());
        if (recorded.isEmpty() || decision.getRequestedSlaveVolume() == null) {
            return notFound(decision);
        }
        Position position = recorded.get();
        BigDecimal newSlaveVolume = decision.getRequestedSlaveVolume();
        BigDecimal closeVolume = position.getSlaveVolume().subtract(newSlaveVolume);

        if (closeVolume.signum() <= 0) {
            // Reduction smaller than one lot step: nothing to send, keep the ledger in step.
            try {
                positionLedger.adjust(position.getMasterPositionId(), decision.getMasterVolume(), position.getSlaveVolume());
            } catch (PositionNotFoundException e) {
                log.warn("Position {} left the ledger before its master volume was updated", position.getMasterPositionId());
                return OrderOutcome.failed(OrderErrorKind.NOT_FOUND, e.getMessage());
            }
            CopyDecision unchangedSlave = decision.toBuilder().requestedSlaveVolume(position.getSlaveVolume()).build();
            copyLogger.logAdjust(unchangedSlave, position.getMasterVolume(), position.getSlaveVolume(), BigDecimal.ZERO);
            return OrderOutcome.accepted(position.getSlavePositionId());
        }

        OrderRequest orderRequest = closeRequest(position, closeVolume);
        OrderOutcome outcome = execute(decision, orderRequest, tradingChannel::closePosition);
        if (!outcome.isAccepted()) {
            return outcome;
        }

        try {
            positionLedger.adjust(position.getMasterPositionId(), decision.getMasterVolume(), newSlaveVolume);
        } catch (PositionNotFoundException e) {
            log.warn("Position {} left the ledger while its partial close was in flight", position.getMasterPositionId());
        }
        copyLogger.logAdjust(decision, position.getMasterVolume(), position.getSlaveVolume(), closeVolume);
        return OrderOutcome.accepted(position.getSlavePositionId());
    }

    private OrderRequest closeRequest(Position position, BigDecimal volume) {
        return OrderRequest.builder()
                .accountId(tradingChannel.accountId(AccountRole.SLAVE))
                .instrumentId(position.getSlaveInstrumentId())
                .side(position.getSide())
                .volume(volume)
                .linkedPositionId(position.getSlavePositionId() != null ? position.getSlavePositionId() : 0L)
                .label(OrderRequest.labelFor(position.getMasterPositionId()))
                .kind(OrderKind.CLOSE_POSITION)
                .build();
    }

    private OrderOutcome notFound(CopyDecision decision) {
        copyLogger.logError(decision, decision.getAction() + " for a position not in the ledger");
        applicationEventPublisher.publishEvent(new ReconciliationRequestedEvent(
                this, "No ledger entry for master position " + decision.getMasterPositionId()));
        return OrderOutcome.failed(OrderErrorKind.NOT_FOUND, "position not in ledger");
    }

    /**
     * Sends one request through the rate limiter and retry, translating every failure into an
     * outcome.
     */
    private OrderOutcome execute(
            CopyDecision decision,
            OrderRequest orderRequest,
            Function<OrderRequest, CompletableFuture<OrderOutcome>> sender) {
        AtomicInteger attempt = new AtomicInteger();
        Supplier<OrderOutcome> attemptSupplier = () -> {
            OrderRequest attemptRequest = orderRequest.toBuilder().attemptNo(attempt.incrementAndGet()).build();
            if (attemptRequest.getAttemptNo() > 1) {
                log.info(
                        "Retrying {} for masterPositionId={}, attempt {}",
                        attemptRequest.getKind(),
                        decision.getMasterPositionId(),
                        attemptRequest.getAttemptNo());
            }
            return await(sender.apply(attemptRequest));
        };
        Supplier<OrderOutcome> decorated =
                Retry.decorateSupplier(tradingOrdersRetry, RateLimiter.decorateSupplier(tradingOrdersLimiter, attemptSupplier));

        try {
            return decorated.get();
        } catch (RejectedOrderException e) {
            copyLogger.logError(decision, "Rejected by venue (" + e.getVenueErrorCode() + "): " + e.getMessage());
            if ("POSITION_NOT_FOUND".equals(e.getVenueErrorCode())) {
                applicationEventPublisher.publishEvent(new ReconciliationRequestedEvent(
                        this, "Venue reports slave position missing for master " + decision.getMasterPositionId()));
            }
            return OrderOutcome.failed(OrderErrorKind.REJECTED, e.getMessage());
        } catch (VenueRateLimitException e) {
            copyLogger.logError(decision, "Venue rate limit persisted after " + attempt.get() + " attempts");
            return OrderOutcome.failed(OrderErrorKind.RATE_LIMITED, e.getMessage());
        } catch (TransportException e) {
            copyLogger.logError(decision, "Transport failure after " + attempt.get() + " attempts: " + e.getMessage());
            return OrderOutcome.failed(OrderErrorKind.TRANSPORT, e.getMessage());
        } catch (RequestNotPermitted e) {
            copyLogger.logError(decision, "No trading permit within the limiter timeout");
            return OrderOutcome.failed(OrderErrorKind.RATE_LIMITED, e.getMessage());
        } catch (AuthException e) {
            copyLogger.logError(decision, "Authorization refused: " + e.getMessage());
            return OrderOutcome.failed(OrderErrorKind.AUTH, e.getMessage());
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for the venue", e);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new TransportException("No response within " + responseTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransportException("Request failed: " + cause, cause);
        }
    }
}
