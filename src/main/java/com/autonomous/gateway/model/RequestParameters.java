package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class RequestParameters {
    @Builder.Default
    double temperature = 1.0;
    @Builder.Default
    int maxTokens = 4096;
    @Builder.Default
    double topP = 1.0;
    Integer topK;
    Double frequencyPenalty;
    Double presencePenalty;
    @Builder.Default
    List<String> stopSequences = List.of();
    @Builder.Default
    ResponseFormat responseFormat = ResponseFormat.PLAIN_TEXT;
    boolean streamingEnabled;

    public static RequestParameters defaults() {
        return RequestParameters.builder().build();
    }
}
