package com.autonomous.gateway.service;

import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.TokenUsage;
import lombok.Builder;
import lombok.Value;

/**
 * Reply of one chat turn. {@code usage} is provider-reported; the estimates are local.
 */
@Value
@Builder
public class MessageResult {
    String response;
    String sessionId;
    TokenUsage usage;
    String model;
    ProviderType providerId;
    int estimatedInputTokens;
    int estimatedOutputTokens;
}
