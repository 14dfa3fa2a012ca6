package com.autonomous.gateway.tokenizer;

import com.autonomous.gateway.model.Message;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link TokenCounter} backed by JTokkit. The encoding is picked by model-name prefix;
 * Claude, HuggingFace and unknown models are approximated with cl100k_base.
 */
@Slf4j
public class JTokkitTokenCounter implements TokenCounter {

    private final EncodingRegistry registry;
    private final Encoding encoding;

    public JTokkitTokenCounter(String modelName) {
        this(Encodings.newDefaultEncodingRegistry(), modelName);
    }

    public JTokkitTokenCounter(EncodingRegistry registry, String modelName) {
        this.registry = registry;
        this.encoding = encodingForModel(modelName);
        log.debug("Token counter for model '{}' uses {}", modelName, encoding.getName());
    }

    @Override
    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }

    @Override
    public int countTokens(List<Message> messages) {
        return messages.stream()
            .mapToInt(message -> countTokens(message.getText()))
            .sum();
    }

    @Override
    public int countTokensWithFormatting(List<Message> messages, String systemPrompt) {
        int formattingOverhead = messages.size() * MESSAGE_OVERHEAD;
        int systemTokens = systemPrompt != null ? countTokens(systemPrompt) + MESSAGE_OVERHEAD : 0;
        return systemTokens + countTokens(messages) + formattingOverhead + REQUEST_OVERHEAD;
    }

    public int countTokensForModel(String text, String model) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encodingForModel(model).countTokens(text);
    }

    Encoding encodingForModel(String model) {
        String name = model == null ? "" : model.toLowerCase();
        if (name.startsWith("gpt-5") || name.startsWith("o1") || name.startsWith("gpt-4o")) {
            return registry.getEncoding(EncodingType.O200K_BASE);
        }
        return registry.getEncoding(EncodingType.CL100K_BASE);
    }
}
