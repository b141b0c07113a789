package com.steadyretry.error;

/**
 * Base of every exception raised by the retry machinery itself (never by the retried operation).
 */
public class RetryException extends RuntimeException {

    public RetryException(String message) {
        super(message);
    }

    public RetryException(String message, Throwable cause) {
        super(message, cause);
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "<nil>";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
