package com.autonomous.gateway.error;

/** Raised by the provider factory for a type that was never registered. */
public class UnsupportedProviderException extends AIException {

    public UnsupportedProviderException(String message) {
        super(message);
    }
}
