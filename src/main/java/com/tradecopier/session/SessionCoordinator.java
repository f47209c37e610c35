package com.tradecopier.session;

import com.tradecopier.broker.OpenApiTransport;
import com.tradecopier.broker.TraderInfo;
import com.tradecopier.broker.TransportListener;
import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.domain.model.SpotQuote;
import com.tradecopier.engine.ExecutionEventQueue;
import com.tradecopier.engine.SequenceTracker;
import com.tradecopier.event.SessionEvent;
import com.tradecopier.event.SessionEventType;
import com.tradecopier.exception.AuthException;
import com.tradecopier.exception.TransportException;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.symbol.SymbolCatalog;
import com.tradecopier.symbol.SymbolMapper;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Owns the single Open API connection shared by the master and slave accounts.
 *
 * <p>Session bring-up walks {@code DISCONNECTED -> CONNECTING -> APP_AUTHENTICATED ->
 * ACCOUNTS_AUTHORIZED -> SUBSCRIBED -> RUNNING}:
 * <ol>
 *   <li>connect and authenticate the application,</li>
 *   <li>check both account ids against their access tokens and authorize both accounts,</li>
 *   <li>load instrument specifications, subscribe spots for the configured symbols on both
 *       accounts and read both accounts' deposit assets and balances,</li>
 *   <li>start a new sequence epoch and publish SESSION_SUBSCRIBED, whose listeners rebuild the
 *       ledger before this method continues,</li>
 *   <li>enter RUNNING and forward the master execution events buffered so far, in order.</li>
 * </ol>
 * Any failure tears the connection down, discards the buffer and schedules a reconnect with
 * exponential backoff. Auth failures and {@code max-connect-attempts} consecutive failures are
 * fatal and publish SESSION_FATAL.
 *
 * <p>Every other component reaches the connection through {@link TradingChannel}. Requests are
 * handed to a single writer thread, so the transport only ever has one caller.
 */
@Service
public class SessionCoordinator implements TradingChannel, TransportListener, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    static final int PHASE = 100;

    private static final Set<SessionState> SENDABLE_STATES =
            EnumSet.of(SessionState.ACCOUNTS_AUTHORIZED, SessionState.SUBSCRIBED, SessionState.RUNNING);

    private final OpenApiTransport openApiTransport;
    private final CopierProperties copierProperties;
    private final SymbolMapper symbolMapper;
    private final SymbolCatalog symbolCatalog;
    private final SequenceTracker sequenceTracker;
    private final ExecutionEventQueue executionEventQueue;
    private final CopyLogger copyLogger;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.DISCONNECTED);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong generation = new AtomicLong();
    private final Object bufferLock = new Object();
    private final List<ExecutionEvent> bufferedEvents = new ArrayList<>();

    private ScheduledExecutorService connector;
    private ExecutorService writer;

    public SessionCoordinator(
            OpenApiTransport openApiTransport,
            CopierProperties copierProperties,
            SymbolMapper symbolMapper,
            SymbolCatalog symbolCatalog,
            SequenceTracker sequenceTracker,
            ExecutionEventQueue executionEventQueue,
            CopyLogger copyLogger,
            ApplicationEventPublisher applicationEventPublisher) {
        this.openApiTransport = openApiTransport;
        this.copierProperties = copierProperties;
        this.symbolMapper = symbolMapper;
        this.symbolCatalog = symbolCatalog;
        this.sequenceTracker = sequenceTracker;
        this.executionEventQueue = executionEventQueue;
        this.copyLogger = copyLogger;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Lifecycle ----

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            connector = Executors.newSingleThreadScheduledExecutor(daemon("session-connector"));
            writer = Executors.newSingleThreadExecutor(daemon("session-writer"));
            consecutiveFailures.set(0);
            connector.execute(this::establishSession);
            log.info("SessionCoordinator started ({} environment)", copierProperties.getEnvironment());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        connector.shutdownNow();
        writer.shutdown();
        openApiTransport.disconnect();
        discardBuffer("shutdown");
        transition(SessionState.DISCONNECTED, SessionEventType.SESSION_STOPPED, "Coordinator stopped");
        log.info("SessionCoordinator stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    // ---- Session bring-up ----

    void establishSession() {
        if (!running.get()) {
            return;
        }
        long sessionGeneration = generation.incrementAndGet();
        CopierProperties.Account master = copierProperties.getMaster();
        CopierProperties.Account slave = copierProperties.getSlave();
        List<Long> masterInstruments = symbolMapper.instrumentIds(AccountRole.MASTER);
        List<Long> slaveInstruments = symbolMapper.instrumentIds(AccountRole.SLAVE);

        try {
            transition(SessionState.CONNECTING, SessionEventType.SESSION_CONNECTING, "Connecting");
            openApiTransport.subscribeExecutionEvents(this);
            openApiTransport.connect(copierProperties.getEnvironment());

            await(openApiTransport.authenticateApplication(
                    copierProperties.getApplication().getClientId(),
                    copierProperties.getApplication().getClientSecret()));
            transition(SessionState.APP_AUTHENTICATED, SessionEventType.APPLICATION_AUTHENTICATED, "Application authenticated");

            authorize(AccountRole.MASTER, master);
            authorize(AccountRole.SLAVE, slave);
            transition(SessionState.ACCOUNTS_AUTHORIZED, SessionEventType.ACCOUNTS_AUTHORIZED, "Master and slave authorized");

            symbolCatalog.clear();
            symbolCatalog.registerSpecs(
                    AccountRole.MASTER, await(openApiTransport.loadInstrumentSpecs(master.getAccountId(), masterInstruments)));
            symbolCatalog.registerSpecs(
                    AccountRole.SLAVE, await(openApiTransport.loadInstrumentSpecs(slave.getAccountId(), slaveInstruments)));
            await(openApiTransport.subscribeSpots(master.getAccountId(), masterInstruments));
            await(openApiTransport.subscribeSpots(slave.getAccountId(), slaveInstruments));
            loadTraderInfo(AccountRole.MASTER, master.getAccountId());
            loadTraderInfo(AccountRole.SLAVE, slave.getAccountId());

            long epoch = sequenceTracker.reset();
            // Listeners rebuild the ledger synchronously before RUNNING.
            transition(SessionState.SUBSCRIBED, SessionEventType.SESSION_SUBSCRIBED, "Subscribed, epoch " + epoch);

            enterRunning();
            consecutiveFailures.set(0);
        } catch (AuthException e) {
            fatal("Authorization refused: " + e.getMessage());
        } catch (RuntimeException e) {
            if (generation.get() == sessionGeneration) {
                handleFailure("Session setup failed: " + e.getMessage());
            }
        }
    }

    private void authorize(AccountRole role, CopierProperties.Account account) {
        List<Long> permitted = await(openApiTransport.listAccounts(account.getAccessToken()));
        if (!permitted.contains(account.getAccountId())) {
            throw new AuthException(String.format(
                    "%s account %d is not accessible with its access token (token grants %s)",
                    role, account.getAccountId(), permitted));
        }
        await(openApiTransport.authorizeAccount(account.getAccountId(), account.getAccessToken()));
        log.info("{} account {} authorized", role, account.getAccountId());
    }

    private void loadTraderInfo(AccountRole role, long accountId) {
        TraderInfo traderInfo = await(openApiTransport.queryTrader(accountId));
        symbolCatalog.setDepositAsset(role, traderInfo.getDepositAsset());
        log.info(
                "{} account {}: balance {} {}",
                role,
                accountId,
                traderInfo.getBalance(),
                traderInfo.getDepositAsset());
    }

    private void enterRunning() {
        int flushed;
        synchronized (bufferLock) {
            state.set(SessionState.RUNNING);
            flushed = bufferedEvents.size();
            bufferedEvents.forEach(executionEventQueue::offer);
            bufferedEvents.clear();
        }
        publish(SessionEventType.SESSION_RUNNING, SessionState.SUBSCRIBED, SessionState.RUNNING,
                "Running, " + flushed + " buffered events forwarded");
        log.info("Session RUNNING, forwarded {} buffered master events", flushed);
    }

    private void handleFailure(String reason) {
        if (!running.get() || state.get() == SessionState.DISCONNECTED) {
            return;
        }
        openApiTransport.disconnect();
        discardBuffer(reason);
        transition(SessionState.DISCONNECTED, SessionEventType.CONNECTION_LOST, reason);

        int failures = consecutiveFailures.incrementAndGet();
        int maxAttempts = copierProperties.getReconnect().getMaxConnectAttempts();
        if (failures >= maxAttempts) {
            fatal("Giving up after " + failures + " consecutive connection failures: " + reason);
            return;
        }

        Duration delay = backoffDelay(failures);
        log.warn("{}; reconnect attempt {}/{} in {}", reason, failures, maxAttempts, delay);
        try {
            connector.schedule(this::establishSession, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.info("Reconnect not scheduled, coordinator is stopping");
        }
    }

    /** {@code initialDelay * 2^(failures-1)}, capped at {@code maxDelay}. */
    Duration backoffDelay(int failures) {
        Duration initial = copierProperties.getReconnect().getInitialDelay();
        Duration max = copierProperties.getReconnect().getMaxDelay();
        Duration delay = initial;
        for (int i = 1; i < failures && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private void fatal(String reason) {
        copyLogger.logError(reason);
        running.set(false);
        openApiTransport.disconnect();
        discardBuffer(reason);
        SessionState previous = state.getAndSet(SessionState.DISCONNECTED);
        publish(SessionEventType.SESSION_FATAL, previous, SessionState.DISCONNECTED, reason);
    }

    private void discardBuffer(String reason) {
        synchronized (bufferLock) {
            if (!bufferedEvents.isEmpty()) {
                log.warn("Discarding {} buffered master events: {}", bufferedEvents.size(), reason);
                bufferedEvents.clear();
            }
        }
    }

    // ---- TransportListener ----

    @Override
    public void onExecutionEvent(long accountId, ExecutionEvent event) {
        if (accountId != copierProperties.getMaster().getAccountId()) {
            log.debug("Ignoring execution event for account {}", accountId);
            return;
        }
        synchronized (bufferLock) {
            if (state.get().isRunning()) {
                executionEventQueue.offer(event);
            } else {
                bufferedEvents.add(event);
            }
        }
    }

    @Override
    public void onSpot(long accountId, SpotQuote quote) {
        AccountRole role = accountId == copierProperties.getMaster().getAccountId() ? AccountRole.MASTER : AccountRole.SLAVE;
        symbolCatalog.updateSpot(role, quote);
    }

    @Override
    public void onDisconnected(String reason) {
        long disconnectedGeneration = generation.get();
        try {
            connector.execute(() -> {
                if (generation.get() == disconnectedGeneration) {
                    handleFailure("Connection lost: " + reason);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Disconnect after coordinator stop: {}", reason);
        }
    }

    // ---- TradingChannel ----

    @Override
    public CompletableFuture<OrderOutcome> sendOrder(OrderRequest orderRequest) {
        return submit(() -> openApiTransport.sendOrder(orderRequest.getAccountId(), orderRequest));
    }

    @Override
    public CompletableFuture<OrderOutcome> closePosition(OrderRequest orderRequest) {
        return submit(() -> openApiTransport.closePosition(orderRequest.getAccountId(), orderRequest));
    }

    @Override
    public CompletableFuture<List<BrokerPosition>> queryOpenPositions(AccountRole role) {
        return submit(() -> openApiTransport.queryOpenPositions(accountId(role)));
    }

    @Override
    public CompletableFuture<BigDecimal> queryBalance(AccountRole role) {
        return submit(() -> openApiTransport.queryBalance(accountId(role)));
    }

    @Override
    public long accountId(AccountRole role) {
        return role == AccountRole.MASTER
                ? copierProperties.getMaster().getAccountId()
                : copierProperties.getSlave().getAccountId();
    }

    @Override
    public SessionState getState() {
        return state.get();
    }

    public int getBufferedEventCount() {
        synchronized (bufferLock) {
            return bufferedEvents.size();
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> request) {
        SessionState current = state.get();
        if (!SENDABLE_STATES.contains(current)) {
            return CompletableFuture.failedFuture(new TransportException("Session not ready: " + current));
        }
        try {
            return CompletableFuture.supplyAsync(request, writer).thenCompose(future -> future);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new TransportException("Session is shutting down"));
        }
    }

    // ---- Helpers ----

    private void transition(SessionState newState, SessionEventType eventType, String message) {
        SessionState previous = state.getAndSet(newState);
        publish(eventType, previous, newState, message);
    }

    private void publish(SessionEventType eventType, SessionState previous, SessionState newState, String message) {
        log.info("Session {} -> {}: {}", previous, newState, message);
        applicationEventPublisher.publishEvent(new SessionEvent(this, eventType, previous, newState, message));
    }

    private <T> T await(CompletableFuture<T> future) {
        Duration timeout = copierProperties.getTransport().getRequestTimeout().multipliedBy(2);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during session setup", e);
        } catch (TimeoutException e) {
            throw new TransportException("No response within " + timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransportException("Session request failed: " + e.getCause(), e.getCause());
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
