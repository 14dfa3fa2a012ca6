package com.autonomous.gateway.compression;

import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Summarizes everything except the newest {@code slidingWindowKeepLast} messages.
 */
public class SlidingWindowCompression implements CompressionAlgorithm {

    @Override
    public boolean shouldCompress(List<Message> messages, CompressionConfig config, Integer contextWindowSize) {
        return messages.size() >= config.getSlidingWindowMessageThreshold();
    }

    @Override
    public CompressionResult compress(List<Message> messages, CompressionConfig config,
                                      Function<List<Message>, String> summarizer) {
        int keepLast = Math.max(0, config.getSlidingWindowKeepLast());
        if (messages.isEmpty() || messages.size() <= keepLast) {
            return CompressionResult.unchanged(messages);
        }

        int split = messages.size() - keepLast;
        List<Message> toCompress = messages.subList(0, split);
        List<Message> toKeep = messages.subList(split, messages.size());

        String summary = summarizer.apply(toCompress);
        List<Message> newMessages = new ArrayList<>();
        newMessages.add(CompressionAlgorithm.summaryMessage(summary, toCompress.size(), toKeep.size()));
        newMessages.addAll(toKeep);
        return CompressionResult.compressed(messages, newMessages, toCompress);
    }
}
