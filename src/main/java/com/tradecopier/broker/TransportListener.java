package com.tradecopier.broker;

import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.SpotQuote;

/**
 * Unsolicited traffic from the Open API connection. Called on the transport's receive thread;
 * implementations must hand work off and return quickly.
 */
public interface TransportListener {

    /** An execution event for an account that was not the answer to one of our requests. */
    void onExecutionEvent(long accountId, ExecutionEvent event);

    void onSpot(long accountId, SpotQuote quote);

    /** The connection is gone. Pending requests have already been failed. */
    void onDisconnected(String reason);
}
