package com.tradecopier.reconciliation;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.DecisionReason;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.domain.model.AccountSnapshot;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.domain.model.Position;
import com.tradecopier.engine.CopyWorkerPool;
import com.tradecopier.event.ReconciliationRequestedEvent;
import com.tradecopier.event.SessionEvent;
import com.tradecopier.event.SessionEventType;
import com.tradecopier.exception.TransportException;
import com.tradecopier.ledger.PositionLedger;
import com.tradecopier.observability.CopierMetricsService;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.session.TradingChannel;
import com.tradecopier.sizing.AccountSnapshotService;
import com.tradecopier.sizing.VolumeCalculator;
import com.tradecopier.symbol.SymbolMapper;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the {@link PositionLedger} from the positions both accounts report live.
 *
 * <p>Runs synchronously when the session reaches SUBSCRIBED (before RUNNING), out of band after a
 * dispatch found no ledger entry, and on the manual REST trigger. Pairing, for mapped master
 * instruments only:
 * <ol>
 *   <li>by label: a slave position labelled {@code copy:<masterPositionId>} belongs to that
 *       master position,</li>
 *   <li>by heuristic: mapped slave instrument, same side, open times within
 *       {@code open-time-tolerance}, and slave/master volume ratio within
 *       {@code volume-ratio-tolerance} (relative) of the ratio the active policy would produce.
 *       The candidate with the closest open time wins.</li>
 * </ol>
 * Unpaired master positions are submitted to the worker pool as OPEN decisions. Unpaired slave
 * positions are logged and otherwise ignored.
 */
@Service
public class LedgerReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(LedgerReconciliationService.class);

    static final String TRIGGER_SUBSCRIBED = "SESSION_SUBSCRIBED";
    static final String TRIGGER_MANUAL = "MANUAL";

    private final TradingChannel tradingChannel;
    private final SymbolMapper symbolMapper;
    private final VolumeCalculator volumeCalculator;
    private final AccountSnapshotService accountSnapshotService;
    private final PositionLedger positionLedger;
    private final CopyWorkerPool copyWorkerPool;
    private final CopyLogger copyLogger;
    private final CopierMetricsService copierMetricsService;
    private final Duration openTimeTolerance;
    private final BigDecimal volumeRatioTolerance;
    private final Duration queryTimeout;

    private final ExecutorService outOfBandExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "ledger-reconcile");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean outOfBandPending = new AtomicBoolean(false);

    private volatile ReconciliationResult lastResult;

    public LedgerReconciliationService(
            TradingChannel tradingChannel,
            SymbolMapper symbolMapper,
            VolumeCalculator volumeCalculator,
            AccountSnapshotService accountSnapshotService,
            PositionLedger positionLedger,
            CopyWorkerPool copyWorkerPool,
            CopyLogger copyLogger,
            CopierMetricsService copierMetricsService,
            CopierProperties copierProperties) {
        this.tradingChannel = tradingChannel;
        this.symbolMapper = symbolMapper;
        this.volumeCalculator = volumeCalculator;
        this.accountSnapshotService = accountSnapshotService;
        this.positionLedger = positionLedger;
        this.copyWorkerPool = copyWorkerPool;
        this.copyLogger = copyLogger;
        this.copierMetricsService = copierMetricsService;
        this.openTimeTolerance = copierProperties.getReconciliation().getOpenTimeTolerance();
        this.volumeRatioTolerance = copierProperties.getReconciliation().getVolumeRatioTolerance();
        this.queryTimeout = copierProperties.getTransport().getRequestTimeout().multipliedBy(2);
    }

    /**
     * Rebuilds the ledger on the publishing thread. A failure propagates to the Session Coordinator,
     * which treats the session as failed and reconnects.
     */
    @EventListener
    public void onSessionEvent(SessionEvent sessionEvent) {
        if (sessionEvent.getEventType() == SessionEventType.SESSION_SUBSCRIBED) {
            reconcile(TRIGGER_SUBSCRIBED);
        }
    }

    /** Requests arriving while a run is already queued are coalesced into it. */
    @EventListener
    public void onReconciliationRequested(ReconciliationRequestedEvent event) {
        if (!outOfBandPending.compareAndSet(false, true)) {
            log.debug("Reconciliation already queued, coalescing request: {}", event.getReason());
            return;
        }
        outOfBandExecutor.execute(() -> {
            outOfBandPending.set(false);
            if (!tradingChannel.getState().isRunning()) {
                log.info("Session not running, reconciliation deferred to next subscribe: {}", event.getReason());
                return;
            }
            try {
                reconcile(event.getReason());
            } catch (RuntimeException e) {
                log.error("Out-of-band reconciliation failed ({})", event.getReason(), e);
                copyLogger.logError("Reconciliation failed: " + e.getMessage());
            }
        });
    }

    public ReconciliationResult manualReconcile() {
        return reconcile(TRIGGER_MANUAL);
    }

    public Optional<ReconciliationResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    /**
     * Queries both accounts, pairs, rebuilds the ledger and re-submits unpaired master positions.
     *
     * @throws TransportException if either account's positions cannot be read
     */
    public synchronized ReconciliationResult reconcile(String trigger) {
        long startTime = System.currentTimeMillis();
        log.info("Ledger reconciliation started: trigger={}", trigger);

        // Lanes keep dispatching during the run; rows that move after this point keep their live state.
        List<Position> baseline = positionLedger.snapshot();

        List<BrokerPosition> masterPositions = await(tradingChannel.queryOpenPositions(AccountRole.MASTER)).stream()
                .filter(position -> symbolMapper.isMapped(position.getInstrumentId(), AccountRole.MASTER))
                .sorted(Comparator.comparing(BrokerPosition::getPositionId))
                .toList();
        List<BrokerPosition> slavePositions = await(tradingChannel.queryOpenPositions(AccountRole.SLAVE));

        Map<Long, BrokerPosition> unpairedSlaves = new LinkedHashMap<>();
        slavePositions.forEach(position -> unpairedSlaves.put(position.getPositionId(), position));

        Map<Long, Position> paired = new LinkedHashMap<>();
        List<BrokerPosition> unpairedMasters = new ArrayList<>();

        // Label pass
        Map<Long, BrokerPosition> slavesByMasterLabel = new HashMap<>();
        for (BrokerPosition slave : slavePositions) {
            masterIdFromLabel(slave.getLabel()).ifPresent(masterId -> slavesByMasterLabel.putIfAbsent(masterId, slave));
        }
        for (BrokerPosition master : masterPositions) {
            BrokerPosition slave = slavesByMasterLabel.get(master.getPositionId());
            if (slave != null && unpairedSlaves.containsKey(slave.getPositionId())) {
                paired.put(master.getPositionId(), pair(master, slave));
                unpairedSlaves.remove(slave.getPositionId());
            } else {
                unpairedMasters.add(master);
            }
        }
        int pairedByLabel = paired.size();

        // Heuristic pass, oldest master first
        unpairedMasters.sort(Comparator.comparing(BrokerPosition::getOpenedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        Map<Long, AccountSnapshot> snapshots = new HashMap<>();
        List<BrokerPosition> stillUnpaired = new ArrayList<>();
        for (BrokerPosition master : unpairedMasters) {
            Optional<BrokerPosition> match = findHeuristicMatch(master, unpairedSlaves.values(), snapshots);
            if (match.isPresent()) {
                paired.put(master.getPositionId(), pair(master, match.get()));
                unpairedSlaves.remove(match.get().getPositionId());
            } else {
                stillUnpaired.add(master);
            }
        }
        int pairedByHeuristic = paired.size() - pairedByLabel;

        Set<Long> movedDuringRun = positionLedger.rebuild(paired.values(), baseline);
        int carriedOver = (int) movedDuringRun.stream()
                .filter(masterId -> !paired.containsKey(masterId) && positionLedger.contains(masterId))
                .count();
        List<BrokerPosition> toOpen = stillUnpaired.stream()
                .filter(master -> !movedDuringRun.contains(master.getPositionId()))
                .toList();

        for (BrokerPosition master : toOpen) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("masterPositionId", master.getPositionId());
            values.put("instrumentId", master.getInstrumentId());
            values.put("side", master.getSide());
            values.put("masterVolume", master.getVolume());
            copyLogger.logReconcile("Unpaired master position, copying as new", values);
            copyWorkerPool.submitDecision(CopyDecision.builder()
                    .action(CopyAction.OPEN)
                    .instrumentId(master.getInstrumentId())
                    .masterPositionId(master.getPositionId())
                    .side(master.getSide())
                    .masterVolume(master.getVolume())
                    .reason(DecisionReason.RECONCILIATION)
                    .build());
        }
        for (BrokerPosition slave : unpairedSlaves.values()) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("slavePositionId", slave.getPositionId());
            values.put("instrumentId", slave.getInstrumentId());
            values.put("side", slave.getSide());
            values.put("slaveVolume", slave.getVolume());
            copyLogger.logReconcile("Unpaired slave position ignored", values);
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .trigger(trigger)
                .masterPositionCount(masterPositions.size())
                .slavePositionCount(slavePositions.size())
                .pairedByLabel(pairedByLabel)
                .pairedByHeuristic(pairedByHeuristic)
                .carriedOver(carriedOver)
                .unpairedMasterPositionIds(toOpen.stream().map(BrokerPosition::getPositionId).toList())
                .unpairedSlavePositionIds(List.copyOf(unpairedSlaves.keySet()))
                .completedAt(Instant.now())
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        lastResult = result;
        copierMetricsService.recordReconciliation(toOpen.size());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("trigger", trigger);
        summary.put("ledgerSize", positionLedger.size());
        summary.put("byLabel", pairedByLabel);
        summary.put("byHeuristic", pairedByHeuristic);
        summary.put("unpairedMaster", toOpen.size());
        summary.put("unpairedSlave", unpairedSlaves.size());
        copyLogger.logReconcile("Ledger rebuilt", summary);
        return result;
    }

    private Optional<BrokerPosition> findHeuristicMatch(
            BrokerPosition master, Iterable<BrokerPosition> candidates, Map<Long, AccountSnapshot> snapshots) {
        long slaveInstrumentId = symbolMapper.resolve(master.getInstrumentId(), AccountRole.MASTER, AccountRole.SLAVE);
        BigDecimal expectedRatio = expectedRatio(master, snapshots);

        BrokerPosition best = null;
        Duration bestDistance = null;
        for (BrokerPosition slave : candidates) {
            if (slave.getInstrumentId() != slaveInstrumentId || slave.getSide() != master.getSide()) {
                continue;
            }
            if (master.getOpenedAt() == null || slave.getOpenedAt() == null) {
                continue;
            }
            Duration distance = Duration.between(master.getOpenedAt(), slave.getOpenedAt()).abs();
            if (distance.compareTo(openTimeTolerance) > 0) {
                continue;
            }
            if (!withinRatioTolerance(master.getVolume(), slave.getVolume(), expectedRatio)) {
                continue;
            }
            if (bestDistance == null || distance.compareTo(bestDistance) < 0) {
                best = slave;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    private BigDecimal expectedRatio(BrokerPosition master, Map<Long, AccountSnapshot> snapshots) {
        VolumePolicyType policy = volumeCalculator.activePolicy();
        AccountSnapshot snapshot = snapshots.computeIfAbsent(
                master.getInstrumentId(), instrumentId -> accountSnapshotService.snapshotFor(instrumentId, policy));
        BigDecimal expected = volumeCalculator
                .compute(master.getInstrumentId(), master.getVolume(), policy, snapshot)
                .getVolume();
        return expected.divide(master.getVolume(), MathContext.DECIMAL64);
    }

    private boolean withinRatioTolerance(BigDecimal masterVolume, BigDecimal slaveVolume, BigDecimal expectedRatio) {
        if (masterVolume.signum() <= 0 || expectedRatio.signum() <= 0) {
            return false;
        }
        BigDecimal observedRatio = slaveVolume.divide(masterVolume, MathContext.DECIMAL64);
        BigDecimal deviation = observedRatio
                .subtract(expectedRatio)
                .abs()
                .divide(expectedRatio, MathContext.DECIMAL64);
        return deviation.compareTo(volumeRatioTolerance) <= 0;
    }

    private static Position pair(BrokerPosition master, BrokerPosition slave) {
        return Position.builder()
                .instrumentId(master.getInstrumentId())
                .slaveInstrumentId(slave.getInstrumentId())
                .masterPositionId(master.getPositionId())
                .slavePositionId(slave.getPositionId())
                .side(master.getSide())
                .masterVolume(master.getVolume())
                .slaveVolume(slave.getVolume())
                .openedAt(master.getOpenedAt())
                .build();
    }

    static Optional<Long> masterIdFromLabel(String label) {
        if (label == null || !label.startsWith(OrderRequest.LABEL_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(label.substring(OrderRequest.LABEL_PREFIX.length())));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed copier label '{}'", label);
            return Optional.empty();
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(queryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while querying open positions", e);
        } catch (TimeoutException e) {
            throw new TransportException("Open positions query timed out after " + queryTimeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransportException("Open positions query failed: " + e.getCause(), e.getCause());
        }
    }

    @PreDestroy
    void shutdown() {
        outOfBandExecutor.shutdownNow();
    }
}
