package com.autonomous.gateway.model;

import lombok.Value;

@Value
public class TokenUsage {
    int inputTokens;
    int outputTokens;
    int totalTokens;

    public TokenUsage(int inputTokens, int outputTokens) {
        this(inputTokens, outputTokens, inputTokens + outputTokens);
    }

    public TokenUsage(int inputTokens, int outputTokens, int totalTokens) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
        this.totalTokens = totalTokens;
    }
}
