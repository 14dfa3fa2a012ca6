package com.autonomous.gateway.error;

/** Session or task store failure. */
public class DatabaseException extends AIException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
