package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelCapabilities {
    boolean supportsVision;
    @Builder.Default
    boolean supportsStreaming = true;
    @Builder.Default
    int maxTokens = 4096;
    @Builder.Default
    int contextWindow = 8192;
}
