package com.autonomous.gateway.model;

public enum FinishReason {
    STOP, MAX_TOKENS, CONTENT_FILTER, ERROR, CANCELLED, TOOL_USE
}
