package com.tradecopier.unit.api;

import static com.tradecopier.support.CopierTestContext.fill;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradecopier.api.controller.CopierStatusController;
import com.tradecopier.config.ApiResponseAdvice;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.domain.enums.PositionSide;
import com.tradecopier.domain.model.Position;
import com.tradecopier.engine.CopyWorkerPool;
import com.tradecopier.engine.ExecutionEventQueue;
import com.tradecopier.engine.SequenceTracker;
import com.tradecopier.exception.GlobalExceptionHandler;
import com.tradecopier.exception.TransportException;
import com.tradecopier.ledger.PositionLedger;
import com.tradecopier.observability.CopyLogger;
import com.tradecopier.reconciliation.LedgerReconciliationService;
import com.tradecopier.reconciliation.ReconciliationResult;
import com.tradecopier.session.SessionCoordinator;
import com.tradecopier.session.SessionState;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the CopierStatusController.
 */
@ExtendWith(MockitoExtension.class)
class CopierStatusControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SessionCoordinator sessionCoordinator;

    @Mock
    private CopyWorkerPool copyWorkerPool;

    @Mock
    private LedgerReconciliationService ledgerReconciliationService;

    private PositionLedger positionLedger;
    private SequenceTracker sequenceTracker;
    private ExecutionEventQueue executionEventQueue;
    private CopyLogger copyLogger;

    @BeforeEach
    void setUp() {
        positionLedger = new PositionLedger();
        sequenceTracker = new SequenceTracker();
        executionEventQueue = new ExecutionEventQueue();
        copyLogger = new CopyLogger();

        CopierStatusController controller = new CopierStatusController(
                positionLedger,
                sessionCoordinator,
                sequenceTracker,
                executionEventQueue,
                copyWorkerPool,
                ledgerReconciliationService,
                copyLogger);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/copier/positions returns the ledger ordered by master position id")
    void listPositions() throws Exception {
        positionLedger.upsertOpen(position(20L, 5002L, "0.20", "0.10"));
        positionLedger.upsertOpen(position(10L, 5001L, "0.10", "0.05"));

        mockMvc.perform(get("/api/copier/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.data[0].masterPositionId").value(10))
                .andExpect(jsonPath("$.data[0].slavePositionId").value(5001))
                .andExpect(jsonPath("$.data[0].slaveVolume").value(0.05))
                .andExpect(jsonPath("$.data[1].masterPositionId").value(20));
    }

    @Test
    @DisplayName("GET /api/copier/session reports state, epoch and queue depths")
    void getSession() throws Exception {
        when(sessionCoordinator.getState()).thenReturn(SessionState.RUNNING);
        when(sessionCoordinator.accountId(AccountRole.MASTER)).thenReturn(1001L);
        when(sessionCoordinator.accountId(AccountRole.SLAVE)).thenReturn(2002L);
        when(sessionCoordinator.getBufferedEventCount()).thenReturn(0);
        when(copyWorkerPool.laneQueueDepths()).thenReturn(List.of(0, 3, 0, 1));
        sequenceTracker.reset();
        executionEventQueue.offer(fill(10L, 1L, PositionSide.LONG, "0.10", "0.10", 1));
        positionLedger.upsertOpen(position(10L, 5001L, "0.10", "0.05"));

        mockMvc.perform(get("/api/copier/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("RUNNING"))
                .andExpect(jsonPath("$.data.masterAccountId").value(1001))
                .andExpect(jsonPath("$.data.slaveAccountId").value(2002))
                .andExpect(jsonPath("$.data.sequenceEpoch").value(1))
                .andExpect(jsonPath("$.data.inboundQueueDepth").value(1))
                .andExpect(jsonPath("$.data.laneQueueDepths[1]").value(3))
                .andExpect(jsonPath("$.data.ledgerSize").value(1));
    }

    @Test
    @DisplayName("POST /api/copier/reconcile returns the reconciliation result")
    void reconcile() throws Exception {
        when(ledgerReconciliationService.manualReconcile()).thenReturn(ReconciliationResult.builder()
                .trigger("MANUAL")
                .masterPositionCount(3)
                .slavePositionCount(2)
                .pairedByLabel(2)
                .unpairedMasterPositionIds(List.of(30L))
                .completedAt(Instant.parse("2026-03-02T09:30:00Z"))
                .build());

        mockMvc.perform(post("/api/copier/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").doesNotExist())
                .andExpect(jsonPath("$.data.trigger").value("MANUAL"))
                .andExpect(jsonPath("$.data.pairedByLabel").value(2))
                .andExpect(jsonPath("$.data.pairedTotal").value(2))
                .andExpect(jsonPath("$.data.unpairedMasterPositionIds[0]").value(30));
    }

    @Test
    @DisplayName("POST /api/copier/reconcile maps a transport failure to 502 TRANSPORT_ERROR")
    void reconcileWhileDisconnected() throws Exception {
        when(ledgerReconciliationService.manualReconcile())
                .thenThrow(new TransportException("Session not ready: DISCONNECTED"));

        mockMvc.perform(post("/api/copier/reconcile"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.error.code").value("TRANSPORT_ERROR"))
                .andExpect(jsonPath("$.error.retryable").value(true))
                .andExpect(jsonPath("$.error.path").value("/api/copier/reconcile"));
    }

    @Test
    @DisplayName("GET /api/copier/log returns the newest records first, limited")
    void recentLog() throws Exception {
        copyLogger.logReconcile("Ledger rebuilt", Map.of());
        copyLogger.logError("Slave order rejected");
        copyLogger.logVolume(1L, "Raised to minimum", Map.of());

        mockMvc.perform(get("/api/copier/log").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].tag").value("VOLUME"))
                .andExpect(jsonPath("$.data[1].tag").value("ERROR"));
    }

    @Test
    @DisplayName("GET /api/copier/log rejects a non-numeric limit with 400")
    void recentLogInvalidLimit() throws Exception {
        mockMvc.perform(get("/api/copier/log").param("limit", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.retryable").value(false));
    }

    private static Position position(long masterPositionId, long slavePositionId, String masterVolume, String slaveVolume) {
        return Position.builder()
                .instrumentId(1L)
                .slaveInstrumentId(41L)
                .masterPositionId(masterPositionId)
                .slavePositionId(slavePositionId)
                .side(PositionSide.LONG)
                .masterVolume(new BigDecimal(masterVolume))
                .slaveVolume(new BigDecimal(slaveVolume))
                .openedAt(Instant.parse("2026-03-02T09:30:00Z"))
                .build();
    }
}
