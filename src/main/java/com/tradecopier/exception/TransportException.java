package com.tradecopier.exception;

/**
 * Connection-level failure talking to the Open API: socket closed, request timed out, not yet
 * connected, or the venue throttled the request.
 *
 * <p>Always transient. The Order Dispatcher retries it with backoff and the Session Coordinator
 * reconnects on it.
 */
public class TransportException extends BaseException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }

    protected TransportException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
