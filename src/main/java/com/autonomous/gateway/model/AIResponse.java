package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral reply. {@code usage} is what the vendor reported; the estimated
 * counts come from the local tokenizer and are never folded into it.
 */
@Value
@Builder(toBuilder = true)
public class AIResponse {
    String id;
    String content;
    @Builder.Default
    MessageRole role = MessageRole.ASSISTANT;
    String model;
    TokenUsage usage;
    FinishReason finishReason;
    @Singular("metadataEntry")
    Map<String, String> metadata;
    @Builder.Default
    long timestamp = System.currentTimeMillis();
    int estimatedInputTokens;
    int estimatedOutputTokens;
    @Singular
    List<ToolUse> toolUses;
}
