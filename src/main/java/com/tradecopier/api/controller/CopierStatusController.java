package com.tradecopier.api.controller;

import com.tradecopier.api.dto.response.SessionStatusResponse;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.model.Position;
import com.tradecopier.engine.CopyWorkerPool;
import com.tradecopier.engine.ExecutionEventQueue;
import com.tradecopier.engine.SequenceTracker;
import com.tradecopier.ledger.PositionLedger;
import com.tradecopier.observability.CopyLogRecord;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.reconciliation.LedgerReconciliationService;
import com.tradecopier.reconciliation.ReconciliationResult;
import com.tradecopier.session.SessionCoordinator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only diagnostics for the running copier, plus a manual reconciliation trigger.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/copier/positions -- ledger snapshot, ordered by master position id</li>
 *   <li>GET /api/copier/session -- session state and queue depths</li>
 *   <li>POST /api/copier/reconcile -- rebuild the ledger now and return the result</li>
 *   <li>GET /api/copier/log?limit=N -- most recent structured copy log records</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/copier")
public class CopierStatusController {

    private static final Logger log = LoggerFactory.getLogger(CopierStatusController.class);

    private final PositionLedger positionLedger;
    private final SessionCoordinator sessionCoordinator;
    private final SequenceTracker sequenceTracker;
    private final ExecutionEventQueue executionEventQueue;
    private final CopyWorkerPool copyWorkerPool;
    private final LedgerReconciliationService ledgerReconciliationService;
    private final CopyLogger copyLogger;

    public CopierStatusController(
            PositionLedger positionLedger,
            SessionCoordinator sessionCoordinator,
            SequenceTracker sequenceTracker,
            ExecutionEventQueue executionEventQueue,
            CopyWorkerPool copyWorkerPool,
            LedgerReconciliationService ledgerReconciliationService,
            CopyLogger copyLogger) {
        this.positionLedger = positionLedger;
        this.sessionCoordinator = sessionCoordinator;
        this.sequenceTracker = sequenceTracker;
        this.executionEventQueue = executionEventQueue;
        this.copyWorkerPool = copyWorkerPool;
        this.ledgerReconciliationService = ledgerReconciliationService;
        this.copyLogger = copyLogger;
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> listPositions() {
        return ResponseEntity.ok(positionLedger.snapshot());
    }

    @GetMapping("/session")
    public ResponseEntity<SessionStatusResponse> getSession() {
        SessionStatusResponse sessionStatusResponse = SessionStatusResponse.builder()
                .state(sessionCoordinator.getState())
                .masterAccountId(sessionCoordinator.accountId(AccountRole.MASTER))
                .slaveAccountId(sessionCoordinator.accountId(AccountRole.SLAVE))
                .sequenceEpoch(sequenceTracker.currentEpoch())
                .bufferedEvents(sessionCoordinator.getBufferedEventCount())
                .inboundQueueDepth(executionEventQueue.size())
                .laneQueueDepths(copyWorkerPool.laneQueueDepths())
                .ledgerSize(positionLedger.size())
                .build();
        return ResponseEntity.ok(sessionStatusResponse);
    }

    /**
     * Queries both accounts and rebuilds the ledger on the request thread. Fails with
     * TRANSPORT_ERROR while the session is not connected.
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationResult> reconcile() {
        log.info("Manual ledger reconciliation triggered");
        return ResponseEntity.ok(ledgerReconciliationService.manualReconcile());
    }

    @GetMapping("/log")
    public ResponseEntity<List<CopyLogRecord>> recentLog(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(copyLogger.recent(limit));
    }
}
