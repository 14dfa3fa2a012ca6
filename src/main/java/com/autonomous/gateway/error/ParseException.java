package com.autonomous.gateway.error;

/** A success response whose body could not be understood. */
public class ParseException extends AIException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
