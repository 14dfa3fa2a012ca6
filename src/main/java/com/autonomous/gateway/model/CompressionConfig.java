package com.autonomous.gateway.model;

import lombok.Data;

@Data
public class CompressionConfig {
    private boolean enabled = false;
    private CompressionStrategy strategy = CompressionStrategy.FULL_REPLACEMENT;

    // FULL_REPLACEMENT
    private int fullReplacementMessageThreshold = 10;

    // SLIDING_WINDOW
    private int slidingWindowMessageThreshold = 12;
    private int slidingWindowKeepLast = 6;

    // TOKEN_BASED, fractions of the context window and of the stored tokens
    private double tokenBasedThresholdPercent = 0.8;
    private double tokenBasedKeepPercent = 0.4;

    public CompressionConfig copy() {
        CompressionConfig copy = new CompressionConfig();
        copy.setEnabled(enabled);
        copy.setStrategy(strategy);
        copy.setFullReplacementMessageThreshold(fullReplacementMessageThreshold);
        copy.setSlidingWindowMessageThreshold(slidingWindowMessageThreshold);
        copy.setSlidingWindowKeepLast(slidingWindowKeepLast);
        copy.setTokenBasedThresholdPercent(tokenBasedThresholdPercent);
        copy.setTokenBasedKeepPercent(tokenBasedKeepPercent);
        return copy;
    }
}
