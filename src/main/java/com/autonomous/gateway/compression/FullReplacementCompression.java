package com.autonomous.gateway.compression;

import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.Message;

import java.util.List;
import java.util.function.Function;

/**
 * Replaces the whole history with a single summary once it reaches the message threshold.
 */
public class FullReplacementCompression implements CompressionAlgorithm {

    @Override
    public boolean shouldCompress(List<Message> messages, CompressionConfig config, Integer contextWindowSize) {
        return messages.size() >= config.getFullReplacementMessageThreshold();
    }

    @Override
    public CompressionResult compress(List<Message> messages, CompressionConfig config,
                                      Function<List<Message>, String> summarizer) {
        if (messages.isEmpty()) {
            return CompressionResult.unchanged(messages);
        }
        String summary = summarizer.apply(messages);
        Message summaryMessage = CompressionAlgorithm.summaryMessage(summary, messages.size(), 0);
        return CompressionResult.compressed(messages, List.of(summaryMessage), messages);
    }
}
