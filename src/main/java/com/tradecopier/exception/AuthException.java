package com.tradecopier.exception;

/**
 * Thrown when the application credentials or an account access token are refused.
 *
 * <p>Fatal: the Session Coordinator terminates the process instead of reconnecting with the same
 * credentials forever.
 */
public class AuthException extends BaseException {

    public AuthException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }

    public AuthException(String message, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, message, cause);
    }
}
