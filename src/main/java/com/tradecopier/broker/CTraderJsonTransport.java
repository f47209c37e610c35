package com.tradecopier.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.ConnectionEnvironment;
import com.tradecopier.domain.enums.ExecutionEventKind;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.exception.RejectedOrderException;
import com.tradecopier.exception.TransportException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongUnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Open API transport speaking the JSON protocol over a WebSocket on port 5036.
 *
 * <p>Requests are correlated with responses by {@code clientMsgId}. Most requests complete on
 * their first matching response; orders and position closes complete only on the execution
 * event that fills them (an ORDER_ACCEPTED is an intermediate step) or fail on a rejection or
 * error. Every request fails with {@link TransportException} after
 * {@code copier.transport.request-timeout}.
 *
 * <p>Execution events without a pending request, spot events and connection loss go to the
 * registered {@link TransportListener}. Heartbeats are sent every
 * {@code copier.transport.heartbeat-interval} while connected.
 *
 * <p>Outbound frames are chained so that one send completes before the next starts, as the JDK
 * WebSocket requires; sending never blocks the caller.
 */
@Component
public class CTraderJsonTransport implements OpenApiTransport, WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(CTraderJsonTransport.class);

    private static final int PORT = 5036;

    private final OpenApiMessageMapper openApiMessageMapper;
    private final Duration requestTimeout;
    private final Duration heartbeatInterval;
    private final String endpointOverride;

    private final AtomicReference<WebSocket> webSocket = new AtomicReference<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean closingDeliberately = new AtomicBoolean(false);
    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicLong messageCounter = new AtomicLong();
    private final AtomicLong arrivalCounter = new AtomicLong();
    private final Map<Long, Map<Long, Long>> lotSizesByAccount = new ConcurrentHashMap<>();
    private final Map<Long, Map<Long, String>> assetNamesByAccount = new ConcurrentHashMap<>();
    private final StringBuilder messageBuffer = new StringBuilder();
    private final Object sendLock = new Object();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "ctrader-transport-scheduler");
        thread.setDaemon(true);
        return thread;
    });

    private volatile TransportListener transportListener;
    private CompletableFuture<WebSocket> sendChain = CompletableFuture.completedFuture(null);
    private volatile ScheduledFuture<?> heartbeatTask;

    public CTraderJsonTransport(OpenApiMessageMapper openApiMessageMapper, CopierProperties copierProperties) {
        this.openApiMessageMapper = openApiMessageMapper;
        this.requestTimeout = copierProperties.getTransport().getRequestTimeout();
        this.heartbeatInterval = copierProperties.getTransport().getHeartbeatInterval();
        this.endpointOverride = copierProperties.getTransport().getEndpointOverride();
    }

    // ---- Connection ----

    @Override
    public void connect(ConnectionEnvironment environment) {
        URI uri = URI.create(endpointOverride != null && !endpointOverride.isBlank()
                ? endpointOverride
                : "wss://" + environment.getHost() + ":" + PORT);
        log.info("Connecting to Open API at {}", uri);

        closingDeliberately.set(false);
        arrivalCounter.set(0);
        synchronized (messageBuffer) {
            messageBuffer.setLength(0);
        }
        try {
            WebSocket socket = HttpClient.newHttpClient()
                    .newWebSocketBuilder()
                    .connectTimeout(requestTimeout)
                    .buildAsync(uri, this)
                    .get(requestTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            webSocket.set(socket);
            synchronized (sendLock) {
                sendChain = CompletableFuture.completedFuture(socket);
            }
            connected.set(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + uri, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransportException("Cannot connect to " + uri + ": " + e.getMessage(), e);
        }

        heartbeatTask = scheduler.scheduleAtFixedRate(
                this::sendHeartbeat, heartbeatInterval.toMillis(), heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Open API connection established");
    }

    @Override
    public void disconnect() {
        closingDeliberately.set(true);
        boolean wasConnected = connected.getAndSet(false);
        stopHeartbeat();
        WebSocket socket = webSocket.getAndSet(null);
        if (socket != null) {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect").whenComplete((ws, error) -> {
                if (error != null) {
                    log.debug("Close frame not delivered: {}", error.getMessage());
                }
                socket.abort();
            });
        }
        failAllPending(new TransportException("Disconnected"));
        if (wasConnected) {
            log.info("Open API connection closed");
        }
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void subscribeExecutionEvents(TransportListener listener) {
        this.transportListener = listener;
    }

    // ---- Requests ----

    @Override
    public CompletableFuture<Void> authenticateApplication(String clientId, String clientSecret) {
        return request(OpenApiPayloadType.APPLICATION_AUTH_REQ, openApiMessageMapper.applicationAuth(clientId, clientSecret))
                .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<List<Long>> listAccounts(String accessToken) {
        return request(OpenApiPayloadType.GET_ACCOUNTS_BY_ACCESS_TOKEN_REQ, openApiMessageMapper.accessToken(accessToken))
                .thenApply(openApiMessageMapper::toAccountIds);
    }

    @Override
    public CompletableFuture<Void> authorizeAccount(long accountId, String accessToken) {
        return request(OpenApiPayloadType.ACCOUNT_AUTH_REQ, openApiMessageMapper.accountAuth(accountId, accessToken))
                .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<Void> subscribeSpots(long accountId, Collection<Long> instrumentIds) {
        return request(OpenApiPayloadType.SUBSCRIBE_SPOTS_REQ, openApiMessageMapper.symbolsById(accountId, instrumentIds))
                .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<List<InstrumentSpec>> loadInstrumentSpecs(long accountId, Collection<Long> instrumentIds) {
        return assetNames(accountId).thenCompose(assets -> request(
                        OpenApiPayloadType.SYMBOLS_LIST_REQ, openApiMessageMapper.account(accountId))
                .thenCompose(symbolsList -> request(
                                OpenApiPayloadType.SYMBOL_BY_ID_REQ,
                                openApiMessageMapper.symbolsById(accountId, instrumentIds))
                        .thenApply(symbolsById ->
                                openApiMessageMapper.toInstrumentSpecs(symbolsById, symbolsList, assets))))
                .thenApply(specs -> {
                    Map<Long, Long> lotSizes = lotSizesByAccount.computeIfAbsent(accountId, id -> new ConcurrentHashMap<>());
                    specs.forEach(spec -> lotSizes.put(spec.getInstrumentId(), spec.getLotSize()));
                    return specs;
                });
    }

    @Override
    public CompletableFuture<OrderOutcome> sendOrder(long accountId, OrderRequest orderRequest) {
        ObjectNode payload = openApiMessageMapper.newMarketOrder(
                orderRequest.toBuilder().accountId(accountId).build(),
                lotSizes(accountId).applyAsLong(orderRequest.getInstrumentId()));
        return request(OpenApiPayloadType.NEW_ORDER_REQ, payload)
                .thenApply(response -> OrderOutcome.accepted(openApiMessageMapper.executionPositionId(response)));
    }

    @Override
    public CompletableFuture<OrderOutcome> closePosition(long accountId, OrderRequest orderRequest) {
        ObjectNode payload = openApiMessageMapper.closePosition(
                orderRequest.toBuilder().accountId(accountId).build(),
                lotSizes(accountId).applyAsLong(orderRequest.getInstrumentId()));
        return request(OpenApiPayloadType.CLOSE_POSITION_REQ, payload)
                .thenApply(response -> OrderOutcome.accepted(openApiMessageMapper.executionPositionId(response)));
    }

    @Override
    public CompletableFuture<List<BrokerPosition>> queryOpenPositions(long accountId) {
        return request(OpenApiPayloadType.RECONCILE_REQ, openApiMessageMapper.account(accountId))
                .thenApply(response -> openApiMessageMapper.toBrokerPositions(response, lotSizes(accountId)));
    }

    @Override
    public CompletableFuture<TraderInfo> queryTrader(long accountId) {
        return assetNames(accountId).thenCompose(assets -> request(
                        OpenApiPayloadType.TRADER_REQ, openApiMessageMapper.account(accountId))
                .thenApply(response -> openApiMessageMapper.toTraderInfo(response, assets)));
    }

    private CompletableFuture<Map<Long, String>> assetNames(long accountId) {
        Map<Long, String> cached = assetNamesByAccount.get(accountId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return request(OpenApiPayloadType.ASSET_LIST_REQ, openApiMessageMapper.account(accountId))
                .thenApply(response -> {
                    Map<Long, String> names = openApiMessageMapper.toAssetNames(response);
                    assetNamesByAccount.put(accountId, names);
                    return names;
                });
    }

    private LongUnaryOperator lotSizes(long accountId) {
        Map<Long, Long> lotSizes = lotSizesByAccount.getOrDefault(accountId, Map.of());
        return instrumentId -> lotSizes.getOrDefault(instrumentId, OpenApiMessageMapper.DEFAULT_LOT_SIZE);
    }

    private CompletableFuture<JsonNode> request(OpenApiPayloadType payloadType, ObjectNode payload) {
        if (!connected.get()) {
            return CompletableFuture.failedFuture(new TransportException("Not connected"));
        }
        String clientMsgId = "cm-" + messageCounter.incrementAndGet();
        PendingRequest pendingRequest = new PendingRequest(payloadType);
        pendingRequests.put(clientMsgId, pendingRequest);
        pendingRequest.timeout = scheduler.schedule(
                () -> fail(clientMsgId, new TransportException(payloadType + " timed out after " + requestTimeout)),
                requestTimeout.toMillis(),
                TimeUnit.MILLISECONDS);

        send(openApiMessageMapper.envelope(clientMsgId, payloadType, payload)).whenComplete((ws, error) -> {
            if (error != null) {
                fail(clientMsgId, new TransportException("Send failed for " + payloadType, error));
            }
        });
        return pendingRequest.future;
    }

    private CompletableFuture<WebSocket> send(String text) {
        synchronized (sendLock) {
            WebSocket socket = webSocket.get();
            if (socket == null) {
                return CompletableFuture.failedFuture(new TransportException("Not connected"));
            }
            sendChain = sendChain
                    .exceptionally(previousError -> socket)
                    .thenCompose(ignored -> socket.sendText(text, true));
            return sendChain;
        }
    }

    private void sendHeartbeat() {
        if (connected.get()) {
            send(openApiMessageMapper.envelope(null, OpenApiPayloadType.HEARTBEAT_EVENT, null))
                    .whenComplete((ws, error) -> {
                        if (error != null) {
                            log.warn("Heartbeat failed: {}", error.getMessage());
                        }
                    });
        }
    }

    // ---- WebSocket.Listener ----

    @Override
    public void onOpen(WebSocket socket) {
        log.debug("WebSocket opened");
        socket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket socket, CharSequence data, boolean last) {
        String complete = null;
        synchronized (messageBuffer) {
            messageBuffer.append(data);
            if (last) {
                complete = messageBuffer.toString();
                messageBuffer.setLength(0);
            }
        }
        if (complete != null) {
            try {
                handleMessage(complete);
            } catch (RuntimeException e) {
                log.error("Failed to handle Open API message", e);
            }
        }
        socket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket socket, int statusCode, String reason) {
        connectionLost("closed by venue: " + statusCode + " " + reason);
        return null;
    }

    @Override
    public void onError(WebSocket socket, Throwable error) {
        connectionLost("socket error: " + error.getMessage());
    }

    void handleMessage(String text) {
        JsonNode envelope = openApiMessageMapper.parse(text);
        OpenApiPayloadType payloadType = openApiMessageMapper.payloadType(envelope);
        JsonNode payload = envelope.path("payload");
        String clientMsgId = envelope.hasNonNull("clientMsgId") ? envelope.path("clientMsgId").asText() : null;
        PendingRequest pendingRequest = clientMsgId != null ? pendingRequests.get(clientMsgId) : null;

        switch (payloadType) {
            case HEARTBEAT_EVENT -> log.trace("Heartbeat received");
            case SPOT_EVENT -> {
                TransportListener listener = transportListener;
                if (listener != null) {
                    listener.onSpot(payload.path("ctidTraderAccountId").asLong(), openApiMessageMapper.toSpotQuote(payload));
                }
            }
            case EXECUTION_EVENT -> handleExecutionEvent(clientMsgId, pendingRequest, payload);
            case ERROR_RES, OA_ERROR_RES, ORDER_ERROR_EVENT -> {
                if (pendingRequest != null) {
                    fail(clientMsgId, openApiMessageMapper.toVenueException(payload));
                } else {
                    log.warn(
                            "Unsolicited Open API error {}: {} {}",
                            payloadType,
                            payload.path("errorCode").asText(),
                            payload.path("description").asText());
                }
            }
            default -> {
                if (pendingRequest != null) {
                    complete(clientMsgId, payload);
                } else {
                    log.debug("Unhandled Open API message {}", payloadType);
                }
            }
        }
    }

    private void handleExecutionEvent(String clientMsgId, PendingRequest pendingRequest, JsonNode payload) {
        if (pendingRequest != null) {
            ExecutionEventKind kind = openApiMessageMapper.executionKind(payload);
            switch (kind) {
                case ORDER_FILLED, ORDER_PARTIALLY_FILLED -> complete(clientMsgId, payload);
                case ORDER_REJECTED, ORDER_CANCELLED, ORDER_EXPIRED, ORDER_CANCEL_REJECTED -> fail(
                        clientMsgId,
                        new RejectedOrderException(
                                payload.path("errorCode").asText(kind.name()),
                                pendingRequest.payloadType + " ended as " + kind));
                default -> log.debug("{} for {} is not final yet", kind, clientMsgId);
            }
            return;
        }

        long accountId = payload.path("ctidTraderAccountId").asLong();
        ExecutionEvent event = openApiMessageMapper.toExecutionEvent(
                payload, arrivalCounter.incrementAndGet(), lotSizes(accountId));
        TransportListener listener = transportListener;
        if (listener != null) {
            listener.onExecutionEvent(accountId, event);
        }
    }

    private void connectionLost(String reason) {
        if (!connected.getAndSet(false)) {
            return;
        }
        stopHeartbeat();
        webSocket.set(null);
        failAllPending(new TransportException("Connection lost: " + reason));
        if (closingDeliberately.get()) {
            return;
        }
        log.warn("Open API connection lost: {}", reason);
        TransportListener listener = transportListener;
        if (listener != null) {
            listener.onDisconnected(reason);
        }
    }

    private void complete(String clientMsgId, JsonNode payload) {
        PendingRequest pendingRequest = pendingRequests.remove(clientMsgId);
        if (pendingRequest != null) {
            pendingRequest.cancelTimeout();
            pendingRequest.future.complete(payload);
        }
    }

    private void fail(String clientMsgId, RuntimeException error) {
        PendingRequest pendingRequest = pendingRequests.remove(clientMsgId);
        if (pendingRequest != null) {
            pendingRequest.cancelTimeout();
            pendingRequest.future.completeExceptionally(error);
        }
    }

    private void failAllPending(TransportException error) {
        for (String clientMsgId : new ArrayList<>(pendingRequests.keySet())) {
            fail(clientMsgId, error);
        }
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
            heartbeatTask = null;
        }
    }

    private static final class PendingRequest {

        private final OpenApiPayloadType payloadType;
        private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timeout;

        private PendingRequest(OpenApiPayloadType payloadType) {
            this.payloadType = payloadType;
        }

        private void cancelTimeout() {
            ScheduledFuture<?> task = timeout;
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
