package com.tradecopier.session;

/**
 * Connection lifecycle of the shared Open API session, in the order a healthy session walks
 * through them.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    APP_AUTHENTICATED,
    ACCOUNTS_AUTHORIZED,
    SUBSCRIBED,
    RUNNING;

    /** Whether master execution events are forwarded straight to the workers. */
    public boolean isRunning() {
        return this == RUNNING;
    }
}
