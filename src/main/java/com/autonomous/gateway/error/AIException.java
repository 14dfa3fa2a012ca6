package com.autonomous.gateway.error;

/**
 * Root of the gateway error taxonomy. Every failure that crosses a provider,
 * session or scheduler boundary is one of its subclasses.
 */
public abstract class AIException extends RuntimeException {

    protected AIException(String message) {
        super(message);
    }

    protected AIException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps an arbitrary failure, passing gateway errors through untouched.
     */
    public static AIException from(Throwable e) {
        if (e instanceof AIException) {
            return (AIException) e;
        }
        return new NetworkException("Unknown error: " + e.getMessage(), e);
    }
}
