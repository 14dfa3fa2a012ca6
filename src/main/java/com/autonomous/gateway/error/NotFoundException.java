package com.autonomous.gateway.error;

/** Unknown session or task id. */
public class NotFoundException extends AIException {

    public NotFoundException(String message) {
        super(message);
    }
}
