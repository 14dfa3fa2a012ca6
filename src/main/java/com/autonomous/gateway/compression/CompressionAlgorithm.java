package com.autonomous.gateway.compression;

import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;

import java.util.List;
import java.util.function.Function;

public interface CompressionAlgorithm {

    /**
     * @param contextWindowSize context window of the model in tokens, or null when unknown
     */
    boolean shouldCompress(List<Message> messages, CompressionConfig config, Integer contextWindowSize);

    /**
     * @param summarizer turns the messages being compressed into summary text
     */
    CompressionResult compress(List<Message> messages, CompressionConfig config,
                               Function<List<Message>, String> summarizer);

    /**
     * System message that stands in for the compressed part of the conversation.
     */
    static Message summaryMessage(String summary, int compressedCount, int keptCount) {
        StringBuilder text = new StringBuilder();
        text.append("=== PREVIOUS CONVERSATION CONTEXT ===\n\n");
        text.append("Below is a summary of the previous ").append(compressedCount)
            .append(" messages of this conversation. Use it to understand the current discussion.\n\n");
        text.append(summary).append("\n\n");
        text.append("=== END OF CONTEXT ===");
        if (keptCount > 0) {
            text.append("\n\nThe last ").append(keptCount).append(" messages follow in full.");
        }
        return Message.of(MessageRole.SYSTEM, text.toString());
    }
}
