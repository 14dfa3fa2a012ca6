package com.autonomous.gateway.tokenizer;

import com.autonomous.gateway.model.Message;

import java.util.List;

/**
 * Local token estimation. Estimates are approximate and independent of what a vendor
 * later reports.
 */
public interface TokenCounter {

    /** Tokens per message spent on role and structure markers. */
    int MESSAGE_OVERHEAD = 4;

    /** Tokens spent on the request wrapper as a whole. */
    int REQUEST_OVERHEAD = 3;

    int countTokens(String text);

    int countTokens(List<Message> messages);

    /**
     * Estimate for a complete request: message text, per-message overhead, the system
     * prompt with its own overhead when present, and the request wrapper.
     */
    int countTokensWithFormatting(List<Message> messages, String systemPrompt);
}
