package com.autonomous.gateway.model;

public enum ResponseFormat {
    PLAIN_TEXT,
    JSON,
    XML
}
