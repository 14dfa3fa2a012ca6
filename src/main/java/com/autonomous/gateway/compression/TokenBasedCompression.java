package com.autonomous.gateway.compression;

import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageMetadata;
import com.autonomous.gateway.tokenizer.TokenCounter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Compresses once the stored history approaches the model's context window, keeping the
 * newest messages that fit into {@code tokenBasedKeepPercent} of the current total.
 * <p>
 * A message weighs what the provider reported for it; messages without usage data
 * (user turns, restored history) are counted locally.
 */
public class TokenBasedCompression implements CompressionAlgorithm {

    private final TokenCounter tokenCounter;

    public TokenBasedCompression(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    @Override
    public boolean shouldCompress(List<Message> messages, CompressionConfig config, Integer contextWindowSize) {
        if (contextWindowSize == null || messages.isEmpty()) {
            return false;
        }
        int threshold = (int) (contextWindowSize * config.getTokenBasedThresholdPercent());
        return totalTokens(messages) >= threshold;
    }

    @Override
    public CompressionResult compress(List<Message> messages, CompressionConfig config,
                                      Function<List<Message>, String> summarizer) {
        if (messages.isEmpty()) {
            return CompressionResult.unchanged(messages);
        }

        int tokensToKeep = (int) (totalTokens(messages) * config.getTokenBasedKeepPercent());
        int split = splitIndex(messages, tokensToKeep);
        if (split == 0) {
            return CompressionResult.unchanged(messages);
        }

        List<Message> toCompress = messages.subList(0, split);
        List<Message> toKeep = messages.subList(split, messages.size());

        String summary = summarizer.apply(toCompress);
        List<Message> newMessages = new ArrayList<>();
        newMessages.add(CompressionAlgorithm.summaryMessage(summary, toCompress.size(), toKeep.size()));
        newMessages.addAll(toKeep);
        return CompressionResult.compressed(messages, newMessages, toCompress);
    }

    /**
     * First index of the kept tail. Walks back from the newest message until the budget
     * is exceeded; the newest message is always kept.
     */
    int splitIndex(List<Message> messages, int tokensToKeep) {
        int accumulated = 0;
        int split = messages.size();
        for (int i = messages.size() - 1; i >= 0; i--) {
            int tokens = tokensOf(messages.get(i));
            if (accumulated + tokens > tokensToKeep) {
                split = i + 1;
                break;
            }
            accumulated += tokens;
            split = i;
        }
        return Math.min(split, messages.size() - 1);
    }

    int totalTokens(List<Message> messages) {
        return messages.stream().mapToInt(this::tokensOf).sum();
    }

    private int tokensOf(Message message) {
        MessageMetadata metadata = message.getMetadata();
        if (metadata != null && metadata.getTotalTokens() > 0) {
            return metadata.getTotalTokens();
        }
        if (metadata != null && metadata.getEstimatedTotalTokens() > 0) {
            return metadata.getEstimatedTotalTokens();
        }
        return tokenCounter.countTokens(message.getText());
    }
}
