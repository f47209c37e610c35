package com.tradecopier.event;

import com.tradecopier.session.SessionState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the Session Coordinator on every state transition of the shared connection.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>CopierMetricsService counts reconnects and exposes the current state as a gauge</li>
 *   <li>FatalErrorHandler terminates the process on SESSION_FATAL</li>
 * </ul>
 */
public class SessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final SessionState previousState;
    private final SessionState newState;
    private final String message;
    private final Instant occurredAt;

    public SessionEvent(
            Object source,
            SessionEventType eventType,
            SessionState previousState,
            SessionState newState,
            String message) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.message = message;
        this.occurredAt = Instant.now();
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public SessionState getPreviousState() {
        return previousState;
    }

    public SessionState getNewState() {
        return newState;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /** Whether the session gave up and the process is terminating. */
    public boolean isFatal() {
        return eventType == SessionEventType.SESSION_FATAL;
    }

    @Override
    public String toString() {
        return eventType + " " + previousState + " -> " + newState + ": " + message;
    }
}
