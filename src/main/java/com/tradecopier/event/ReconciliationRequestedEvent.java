package com.tradecopier.event;

import org.springframework.context.ApplicationEvent;

/**
 * Asks the reconciliation service to rebuild the ledger out of band, for instance after a close
 * was classified for a position the ledger does not know.
 */
public class ReconciliationRequestedEvent extends ApplicationEvent {

    private final String reason;

    public ReconciliationRequestedEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
