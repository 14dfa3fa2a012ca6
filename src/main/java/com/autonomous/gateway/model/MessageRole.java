package com.autonomous.gateway.model;

public enum MessageRole {
    USER, ASSISTANT, SYSTEM
}
