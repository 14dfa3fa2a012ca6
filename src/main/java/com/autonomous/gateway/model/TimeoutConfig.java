package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TimeoutConfig {
    @Builder.Default
    long connectTimeoutMs = 10_000;
    @Builder.Default
    long readTimeoutMs = 300_000;
    @Builder.Default
    long writeTimeoutMs = 300_000;

    public static TimeoutConfig defaults() {
        return TimeoutConfig.builder().build();
    }
}
