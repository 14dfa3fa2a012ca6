package com.autonomous.gateway.compression;

import com.autonomous.gateway.error.AIException;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.CompressionStrategy;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.provider.AIProvider;
import com.autonomous.gateway.provider.AIProviderFactory;
import com.autonomous.gateway.service.ProviderConfigRepository;
import com.autonomous.gateway.service.SessionRepository;
import com.autonomous.gateway.tokenizer.TokenCounter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the session's compression strategy and writes the result back to the session.
 * Summaries come from a provider; when that fails a local summary is used instead.
 */
@Slf4j
@Service
public class ChatCompressionService {

    static final double SUMMARY_TEMPERATURE = 0.3;
    static final int SUMMARY_MAX_TOKENS = 1024;
    static final String FALLBACK_MARKER = "[Automatically generated summary]";

    private static final String SUMMARY_PROMPT = "Please write a short but informative summary of the conversation above.\n\n"
        + "Requirements:\n"
        + "1. Keep the key topics and the context of the discussion\n"
        + "2. List the main user questions and the assistant's answers\n"
        + "3. Do not lose important details such as names, dates and technical terms\n"
        + "4. Structure the summary so it is easy to read\n"
        + "5. Be as brief as possible while staying accurate\n\n"
        + "Reply with the summary only, without any additional comments.";

    private final Map<CompressionStrategy, CompressionAlgorithm> algorithms = new EnumMap<>(CompressionStrategy.class);
    private final AIProviderFactory providerFactory;
    private final ProviderConfigRepository configRepository;
    private final SessionRepository sessionRepository;

    public ChatCompressionService(AIProviderFactory providerFactory, ProviderConfigRepository configRepository,
                                  SessionRepository sessionRepository, TokenCounter tokenCounter) {
        this.providerFactory = providerFactory;
        this.configRepository = configRepository;
        this.sessionRepository = sessionRepository;
        algorithms.put(CompressionStrategy.FULL_REPLACEMENT, new FullReplacementCompression());
        algorithms.put(CompressionStrategy.SLIDING_WINDOW, new SlidingWindowCompression());
        algorithms.put(CompressionStrategy.TOKEN_BASED, new TokenBasedCompression(tokenCounter));
    }

    public boolean shouldCompress(ChatSession session, Integer contextWindowSize) {
        CompressionConfig config = session.getCompressionConfig();
        return algorithms.get(config.getStrategy())
            .shouldCompress(session.getMessages(), config, contextWindowSize);
    }

    /**
     * Compresses when the session has compression enabled and its strategy says so.
     *
     * @return the applied result, or empty when nothing was done
     */
    public Optional<CompressionResult> compressIfNeeded(String sessionId, ProviderType providerType, String model,
                                                        Integer contextWindowSize) {
        ChatSession session = sessionRepository.getSession(sessionId);
        if (!session.getCompressionConfig().isEnabled() || !shouldCompress(session, contextWindowSize)) {
            return Optional.empty();
        }
        Result<CompressionResult> result = compressSession(sessionId, providerType, model);
        return Optional.ofNullable(result.getOrNull());
    }

    /**
     * Compresses unconditionally with the session's configured strategy.
     */
    public Result<CompressionResult> compressSession(String sessionId, ProviderType providerType, String model) {
        try {
            ChatSession session = sessionRepository.getSession(sessionId);
            CompressionConfig config = session.getCompressionConfig();
            log.info("Starting compression for session {} with strategy {}", sessionId, config.getStrategy());

            CompressionResult result = algorithms.get(config.getStrategy()).compress(
                session.getMessages(), config, messages -> summarize(messages, providerType, model));

            if (result.isSummaryGenerated()) {
                sessionRepository.applyCompression(sessionId, result);
            }
            log.info("Compression completed for session {}. Original: {}, New: {}, Ratio: {}%",
                sessionId, result.getOriginalMessageCount(), result.getNewMessageCount(),
                String.format("%.2f", result.getCompressionRatio() * 100));
            return Result.success(result);
        } catch (Exception e) {
            log.error("Error during compression for session {}: {}", sessionId, e.getMessage(), e);
            return Result.failure(AIException.from(e));
        }
    }

    public void updateCompressionConfig(String sessionId, CompressionConfig config) {
        sessionRepository.updateCompressionConfig(sessionId, config);
        log.info("Compression strategy updated for session {} to {}", sessionId, config.getStrategy());
    }

    String summarize(List<Message> messages, ProviderType providerType, String model) {
        try {
            log.info("Generating summary for {} messages using provider {}", messages.size(), providerType.getId());
            ProviderConfig config = configRepository.getProviderConfig(providerType);
            AIProvider provider = providerFactory.create(providerType, config);

            AIRequest request = AIRequest.builder()
                .messages(messages)
                .message(Message.of(MessageRole.USER, SUMMARY_PROMPT))
                .model(model != null ? model : config.getDefaultModel())
                .parameters(RequestParameters.builder()
                    .temperature(SUMMARY_TEMPERATURE)
                    .maxTokens(SUMMARY_MAX_TOKENS)
                    .build())
                .build();

            AIResponse response = provider.sendMessage(request).getOrThrow();
            log.info("Summary generated: {} characters", response.getContent().length());
            return response.getContent();
        } catch (Exception e) {
            log.error("Error generating summary, using fallback: {}", e.getMessage());
            return fallbackSummary(messages);
        }
    }

    static String fallbackSummary(List<Message> messages) {
        long userMessages = messages.stream().filter(m -> m.getRole() == MessageRole.USER).count();
        long assistantMessages = messages.stream().filter(m -> m.getRole() == MessageRole.ASSISTANT).count();

        StringBuilder summary = new StringBuilder();
        summary.append("The conversation contains ").append(userMessages).append(" user messages and ")
            .append(assistantMessages).append(" assistant replies.\n\n");
        summary.append("Main topics:\n");
        messages.stream().limit(3).forEach(message -> {
            String text = message.getText();
            summary.append("- ").append(message.getRole()).append(": ")
                .append(text.length() > 100 ? text.substring(0, 100) : text).append("...\n");
        });
        summary.append("\n").append(FALLBACK_MARKER);
        return summary.toString();
    }
}
