package com.tradecopier.session;

import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.domain.model.OrderRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Message-passing access to the shared Open API connection.
 *
 * <p>Implemented by {@link SessionCoordinator}, the only writer to the transport. Every call
 * returns immediately; the future completes when the correlated response arrives. Failures
 * complete the future exceptionally with a {@link com.tradecopier.exception.TransportException},
 * {@link com.tradecopier.exception.RejectedOrderException} or
 * {@link com.tradecopier.exception.AuthException}.
 */
public interface TradingChannel {

    /** Sends a market order. The outcome carries the opened slave position id. */
    CompletableFuture<OrderOutcome> sendOrder(OrderRequest orderRequest);

    /** Closes {@code orderRequest.volume} of the position {@code orderRequest.linkedPositionId}. */
    CompletableFuture<OrderOutcome> closePosition(OrderRequest orderRequest);

    CompletableFuture<List<BrokerPosition>> queryOpenPositions(AccountRole role);

    /** Account balance in deposit currency units. */
    CompletableFuture<BigDecimal> queryBalance(AccountRole role);

    long accountId(AccountRole role);

    SessionState getState();
}
