package com.tradecopier.broker;

import com.tradecopier.domain.enums.ConnectionEnvironment;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.domain.model.OrderRequest;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One connection to an Open API environment, shared by every authorized account.
 *
 * <p>Request methods return at once; their futures complete with the correlated response or
 * exceptionally with {@link com.tradecopier.exception.TransportException} (timeout, not connected,
 * connection lost, venue throttling), {@link com.tradecopier.exception.RejectedOrderException} or
 * {@link com.tradecopier.exception.AuthException}. Volumes are in lots on this interface; the
 * implementation converts to protocol units.
 *
 * <p>Only the Session Coordinator holds a reference to the transport.
 */
public interface OpenApiTransport {

    /**
     * Opens the connection and starts heartbeats. Blocks until the socket is open.
     *
     * @throws com.tradecopier.exception.TransportException if the connection cannot be opened
     */
    void connect(ConnectionEnvironment environment);

    CompletableFuture<Void> authenticateApplication(String clientId, String clientSecret);

    /** Account ids the access token may trade, for diagnosing a wrong account id. */
    CompletableFuture<List<Long>> listAccounts(String accessToken);

    CompletableFuture<Void> authorizeAccount(long accountId, String accessToken);

    /** Registers the receiver of unsolicited execution events, spots and disconnects. */
    void subscribeExecutionEvents(TransportListener listener);

    CompletableFuture<Void> subscribeSpots(long accountId, Collection<Long> instrumentIds);

    CompletableFuture<List<InstrumentSpec>> loadInstrumentSpecs(long accountId, Collection<Long> instrumentIds);

    CompletableFuture<OrderOutcome> sendOrder(long accountId, OrderRequest orderRequest);

    CompletableFuture<OrderOutcome> closePosition(long accountId, OrderRequest orderRequest);

    CompletableFuture<List<BrokerPosition>> queryOpenPositions(long accountId);

    CompletableFuture<TraderInfo> queryTrader(long accountId);

    default CompletableFuture<BigDecimal> queryBalance(long accountId) {
        return queryTrader(accountId).thenApply(TraderInfo::getBalance);
    }

    /** Closes the connection and fails every pending request. Idempotent. */
    void disconnect();

    boolean isConnected();
}
