package com.tradecopier.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.OrderErrorKind;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.event.SessionEvent;
import com.tradecopier.event.SessionEventType;
import com.tradecopier.observability.CopierMetricsService;
import com.tradecopier.session.SessionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CopierMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private CopierMetricsService copierMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        copierMetricsService = new CopierMetricsService(meterRegistry);
    }

    @Test
    @DisplayName("Decisions are counted per action")
    void decisionsPerAction() {
        copierMetricsService.recordDecision(CopyAction.OPEN);
        copierMetricsService.recordDecision(CopyAction.OPEN);
        copierMetricsService.recordDecision(CopyAction.SKIP);

        assertThat(meterRegistry.get("copier.decisions").tag("action", "OPEN").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("copier.decisions").tag("action", "SKIP").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Accepted and failed outcomes go to separate counters")
    void outcomes() {
        copierMetricsService.recordOutcome(OrderOutcome.accepted(5001L));
        copierMetricsService.recordOutcome(OrderOutcome.failed(OrderErrorKind.REJECTED, "TRADING_DISABLED"));

        assertThat(meterRegistry.get("copier.orders.accepted").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("copier.orders.failed").tag("error", "REJECTED").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Reconciliation runs and unpaired positions are counted")
    void reconciliation() {
        copierMetricsService.recordReconciliation(3);
        copierMetricsService.recordReconciliation(0);

        assertThat(meterRegistry.get("copier.reconciliation.runs").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("copier.reconciliation.unpaired").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Session events drive the state gauge and count connection losses")
    void sessionEvents() {
        copierMetricsService.onSessionEvent(new SessionEvent(
                this, SessionEventType.SESSION_RUNNING, SessionState.SUBSCRIBED, SessionState.RUNNING, "Running"));

        assertThat(meterRegistry.get("copier.session.state").gauge().value())
                .isEqualTo(SessionState.RUNNING.ordinal());

        copierMetricsService.onSessionEvent(new SessionEvent(
                this, SessionEventType.CONNECTION_LOST, SessionState.RUNNING, SessionState.DISCONNECTED, "Lost"));

        assertThat(meterRegistry.get("copier.session.state").gauge().value())
                .isEqualTo(SessionState.DISCONNECTED.ordinal());
        assertThat(meterRegistry.get("copier.session.reconnects").counter().count()).isEqualTo(1.0);
    }
}
