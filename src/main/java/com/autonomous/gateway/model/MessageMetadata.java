package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Value;

/**
 * Accounting attached to assistant replies. Provider-reported and locally estimated
 * counts are kept side by side.
 */
@Value
@Builder
public class MessageMetadata {
    String model;
    double responseTimeSeconds;

    int inputTokens;
    int outputTokens;

    int estimatedInputTokens;
    int estimatedOutputTokens;

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }

    public int getEstimatedTotalTokens() {
        return estimatedInputTokens + estimatedOutputTokens;
    }
}
