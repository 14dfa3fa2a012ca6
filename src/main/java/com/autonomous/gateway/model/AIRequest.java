package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral chat request. {@code messages} is in conversation order.
 */
@Value
@Builder(toBuilder = true)
public class AIRequest {
    @Singular
    List<Message> messages;
    String model;
    @Builder.Default
    RequestParameters parameters = RequestParameters.defaults();
    String systemPrompt;
    String sessionId;
    @Singular("metadataEntry")
    Map<String, String> metadata;
    @Singular
    List<ToolDefinition> tools;
}
