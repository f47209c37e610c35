package com.tradecopier.engine;

import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.DecisionReason;
import com.tradecopier.domain.enums.OrderErrorKind;
import com.tradecopier.domain.enums.VolumePolicyType;
import com.tradecopier.domain.model.AccountSnapshot;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.exception.InstrumentNotMappedException;
import com.tradecopier.ledger.PositionLedger;
import com.tradecopier.observability.CopierMetricsService;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.oms.OrderDispatcher;
import com.tradecopier.sizing.AccountSnapshotService;
import com.tradecopier.sizing.VolumeCalculator;
import com.tradecopier.sizing.VolumeResult;
import com.tradecopier.symbol.SymbolMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The per-event copy sequence run by a copy lane: classify, size, dispatch.
 *
 * <p>Not thread-safe per instrument by itself. The {@link CopyWorkerPool} guarantees that events
 * of one instrument run here one at a time and in arrival order, which is what makes the
 * classifier's ledger reads see the result of the previous dispatch.
 */
@Service
public class CopyPipeline {

    private static final Logger log = LoggerFactory.getLogger(CopyPipeline.class);

    private final ExecutionEventClassifier executionEventClassifier;
    private final SequenceTracker sequenceTracker;
    private final PositionLedger positionLedger;
    private final SymbolMapper symbolMapper;
    private final VolumeCalculator volumeCalculator;
    private final AccountSnapshotService accountSnapshotService;
    private final OrderDispatcher orderDispatcher;
    private final CopyLogger copyLogger;
    private final CopierMetricsService copierMetricsService;

    public CopyPipeline(
            ExecutionEventClassifier executionEventClassifier,
            SequenceTracker sequenceTracker,
            PositionLedger positionLedger,
            SymbolMapper symbolMapper,
            VolumeCalculator volumeCalculator,
            AccountSnapshotService accountSnapshotService,
            OrderDispatcher orderDispatcher,
            CopyLogger copyLogger,
            CopierMetricsService copierMetricsService) {
        this.executionEventClassifier = executionEventClassifier;
        this.sequenceTracker = sequenceTracker;
        this.positionLedger = positionLedger;
        this.symbolMapper = symbolMapper;
        this.volumeCalculator = volumeCalculator;
        this.accountSnapshotService = accountSnapshotService;
        this.orderDispatcher = orderDispatcher;
        this.copyLogger = copyLogger;
        this.copierMetricsService = copierMetricsService;
    }

    /** Runs one master execution event end to end. */
    public OrderOutcome process(ExecutionEvent event) {
        CopyDecision decision = executionEventClassifier.classify(event, positionLedger);

        // Only deal ids advance the mark; arrival counters live in a different range.
        if (event.isDealSequenced()
                && decision.getReason() != DecisionReason.DUPLICATE
                && event.getKind().isPositionImpacting()) {
            sequenceTracker.advance(event.getInstrumentId(), event.getSequenceNo());
        }
        copierMetricsService.recordDecision(decision.getAction());

        if (decision.isSkip()) {
            logSkip(event, decision);
            return OrderOutcome.failed(OrderErrorKind.NOT_DISPATCHED, decision.getReason().name());
        }
        return execute(decision);
    }

    /**
     * Sizes (OPEN only) and dispatches a decision. Also the entry point for OPEN decisions issued
     * by reconciliation.
     */
    public OrderOutcome execute(CopyDecision decision) {
        CopyDecision sized = decision;
        if (decision.getAction() == CopyAction.OPEN) {
            try {
                symbolMapper.resolve(decision.getInstrumentId(), AccountRole.MASTER, AccountRole.SLAVE);
            } catch (InstrumentNotMappedException e) {
                copyLogger.logError(decision, e.getMessage());
                return OrderOutcome.failed(OrderErrorKind.REJECTED, e.getMessage());
            }
            VolumePolicyType policy = volumeCalculator.activePolicy();
            AccountSnapshot snapshot = accountSnapshotService.snapshotFor(decision.getInstrumentId(), policy);
            VolumeResult volumeResult =
                    volumeCalculator.compute(decision.getInstrumentId(), decision.getMasterVolume(), policy, snapshot);
            sized = decision.toBuilder().requestedSlaveVolume(volumeResult.getVolume()).build();
            log.debug(
                    "Sized masterPositionId={}: master={} slave={} policy={} fallback={}",
                    decision.getMasterPositionId(),
                    decision.getMasterVolume(),
                    volumeResult.getVolume(),
                    volumeResult.getPolicy(),
                    volumeResult.isFallbackApplied());
        }
        return orderDispatcher.dispatch(sized);
    }

    private void logSkip(ExecutionEvent event, CopyDecision decision) {
        if (decision.getReason() == DecisionReason.VOLUME_INCREASE) {
            log.warn(
                    "Scale-in on masterPositionId={} not mirrored: master volume now {}",
                    event.getMasterPositionId(),
                    event.getResultingMasterVolume());
        } else {
            log.debug(
                    "Skipped {} masterPositionId={} seq={}: {}",
                    event.getKind(),
                    event.getMasterPositionId(),
                    event.getSequenceNo(),
                    decision.getReason());
        }
    }
}
