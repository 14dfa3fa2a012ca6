package com.autonomous.gateway.error;

/** Transport failure, non-success HTTP status or a vendor-reported error. */
public class NetworkException extends AIException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
