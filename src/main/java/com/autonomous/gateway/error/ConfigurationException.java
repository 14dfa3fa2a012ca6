package com.autonomous.gateway.error;

/** Missing or invalid provider credentials or endpoint. */
public class ConfigurationException extends AIException {

    public ConfigurationException(String message) {
        super(message);
    }
}
