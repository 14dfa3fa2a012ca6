package com.autonomous.gateway.controller;

import com.autonomous.gateway.model.ResponseFormat;
import lombok.Data;

/**
 * Body of {@code POST /chat/send}. Unset parameters use the request defaults.
 */
@Data
public class ChatSendRequest {
    private String message;
    private String sessionId;
    private String providerId = "claude";
    private String model;
    private Double temperature;
    private Integer maxTokens;
    private ResponseFormat responseFormat;
}
