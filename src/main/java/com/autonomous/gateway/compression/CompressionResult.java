package com.autonomous.gateway.compression;

import com.autonomous.gateway.model.Message;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one compression pass. When a summary was generated, {@code newMessages}
 * starts with the summary message.
 */
@Value
public class CompressionResult {
    List<Message> newMessages;
    List<Message> archivedMessages;
    boolean summaryGenerated;
    int originalMessageCount;
    int newMessageCount;
    double compressionRatio;

    public static CompressionResult unchanged(List<Message> messages) {
        return new CompressionResult(List.copyOf(messages), List.of(), false,
            messages.size(), messages.size(), 0.0);
    }

    public static CompressionResult compressed(List<Message> original, List<Message> newMessages,
                                               List<Message> archived) {
        return new CompressionResult(List.copyOf(newMessages), List.copyOf(archived), true,
            original.size(), newMessages.size(), 1.0 - ((double) newMessages.size() / original.size()));
    }
}
