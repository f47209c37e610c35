package com.tradecopier.event;

/**
 * Kinds of Open API session lifecycle transitions published as {@link SessionEvent}.
 */
public enum SessionEventType {
    SESSION_CONNECTING,
    APPLICATION_AUTHENTICATED,
    ACCOUNTS_AUTHORIZED,
    SESSION_SUBSCRIBED,
    SESSION_RUNNING,
    /** Transport dropped or a session step failed; a reconnect is scheduled. */
    CONNECTION_LOST,
    /** Orderly shutdown. */
    SESSION_STOPPED,
    /** Auth refused or connect attempts exhausted; the process is terminating. */
    SESSION_FATAL
}
