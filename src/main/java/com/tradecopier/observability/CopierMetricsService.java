package com.tradecopier.observability;

import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.model.OrderOutcome;
import com.tradecopier.event.SessionEvent;
import com.tradecopier.event.SessionEventType;
import com.tradecopier.session.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the copier's Micrometer metrics.
 *
 * <ul>
 *   <li><b>copier.decisions</b> (counter, tag {@code action}): classified execution events</li>
 *   <li><b>copier.orders.accepted</b> (counter): slave orders confirmed by the venue</li>
 *   <li><b>copier.orders.failed</b> (counter, tag {@code error}): decisions that did not reach
 *       or were refused by the venue</li>
 *   <li><b>copier.reconciliation.runs</b> / <b>copier.reconciliation.unpaired</b> (counters)</li>
 *   <li><b>copier.session.reconnects</b> (counter): connection losses</li>
 *   <li><b>copier.session.state</b> (gauge): ordinal of the current {@link SessionState}</li>
 * </ul>
 */
@Service
public class CopierMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter ordersAcceptedCounter;
    private final Counter reconciliationRunsCounter;
    private final Counter reconciliationUnpairedCounter;
    private final Counter reconnectsCounter;
    private final AtomicInteger sessionState = new AtomicInteger(SessionState.DISCONNECTED.ordinal());

    public CopierMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.ordersAcceptedCounter = Counter.builder("copier.orders.accepted")
                .description("Slave orders confirmed by the venue")
                .register(meterRegistry);

        this.reconciliationRunsCounter = Counter.builder("copier.reconciliation.runs")
                .description("Ledger reconciliations performed")
                .register(meterRegistry);

        this.reconciliationUnpairedCounter = Counter.builder("copier.reconciliation.unpaired")
                .description("Master positions without a slave counterpart found by reconciliation")
                .register(meterRegistry);

        this.reconnectsCounter = Counter.builder("copier.session.reconnects")
                .description("Open API connection losses")
                .register(meterRegistry);

        meterRegistry.gauge("copier.session.state", sessionState);
    }

    public void recordDecision(CopyAction action) {
        Counter.builder("copier.decisions")
                .tag("action", action.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordOutcome(OrderOutcome outcome) {
        if (outcome.isAccepted()) {
            ordersAcceptedCounter.increment();
            return;
        }
        Counter.builder("copier.orders.failed")
                .tag("error", outcome.getErrorKind().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordReconciliation(int unpairedMasterPositions) {
        reconciliationRunsCounter.increment();
        reconciliationUnpairedCounter.increment(unpairedMasterPositions);
    }

    @EventListener
    public void onSessionEvent(SessionEvent sessionEvent) {
        sessionState.set(sessionEvent.getNewState().ordinal());
        if (sessionEvent.getEventType() == SessionEventType.CONNECTION_LOST) {
            reconnectsCounter.increment();
        }
    }
}
