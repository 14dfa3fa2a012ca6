package com.autonomous.gateway.model;

public enum CompressionStrategy {
    /** Replace the whole history with one summary. Triggered by message count. */
    FULL_REPLACEMENT,
    /** Summarize everything except the newest N messages. Triggered by message count. */
    SLIDING_WINDOW,
    /** Summarize the oldest messages once stored tokens approach the context window. */
    TOKEN_BASED
}
