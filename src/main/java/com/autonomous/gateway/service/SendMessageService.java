package com.autonomous.gateway.service;

import com.autonomous.gateway.compression.ChatCompressionService;
import com.autonomous.gateway.error.AIException;
import com.autonomous.gateway.model.AIModel;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageContent;
import com.autonomous.gateway.model.MessageMetadata;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.provider.AIProvider;
import com.autonomous.gateway.provider.AIProviderFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One chat turn: compress the history when due, append the user message, send the
 * whole history, append the reply.
 */
@Slf4j
@Service
public class SendMessageService {

    private final AIProviderFactory providerFactory;
    private final SessionRepository sessionRepository;
    private final ProviderConfigRepository configRepository;
    private final ChatCompressionService compressionService;

    public SendMessageService(AIProviderFactory providerFactory, SessionRepository sessionRepository,
                              ProviderConfigRepository configRepository, ChatCompressionService compressionService) {
        this.providerFactory = providerFactory;
        this.sessionRepository = sessionRepository;
        this.configRepository = configRepository;
        this.compressionService = compressionService;
    }

    /**
     * @param sessionId existing session, or null to start a new one
     * @param model     model override, or null for the provider's default
     */
    public Result<MessageResult> sendMessage(String message, String sessionId, ProviderType providerType,
                                             String model, RequestParameters parameters) {
        try {
            log.info("Processing message for provider {}", providerType.getId());

            ChatSession session = sessionId != null
                ? sessionRepository.getSession(sessionId)
                : sessionRepository.createSession(null);

            ProviderConfig config = configRepository.getProviderConfig(providerType);
            AIProvider provider = providerFactory.create(providerType, config);
            String selectedModel = model != null ? model : config.getDefaultModel();

            // the new question stays out of the summary and goes out as the last turn
            compressionService.compressIfNeeded(session.getId(), providerType, selectedModel,
                contextWindowOf(provider, selectedModel));

            sessionRepository.appendMessage(session.getId(), MessageRole.USER, message);

            List<Message> history = sessionRepository.getMessages(session.getId());
            log.debug("Session {} history: {} messages", session.getId(), history.size());

            AIRequest request = AIRequest.builder()
                .messages(history)
                .model(selectedModel)
                .parameters(parameters != null ? parameters : RequestParameters.defaults())
                .sessionId(session.getId())
                .build();

            long started = System.currentTimeMillis();
            AIResponse response = provider.sendMessage(request).getOrThrow();
            double responseTimeSeconds = (System.currentTimeMillis() - started) / 1000.0;

            sessionRepository.appendMessage(session.getId(), Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(MessageContent.text(response.getContent()))
                .metadata(MessageMetadata.builder()
                    .model(response.getModel())
                    .responseTimeSeconds(responseTimeSeconds)
                    .inputTokens(response.getUsage().getInputTokens())
                    .outputTokens(response.getUsage().getOutputTokens())
                    .estimatedInputTokens(response.getEstimatedInputTokens())
                    .estimatedOutputTokens(response.getEstimatedOutputTokens())
                    .build())
                .build());

            log.info("Response received from {}: {} tokens", providerType.getId(), response.getUsage().getTotalTokens());

            return Result.success(MessageResult.builder()
                .response(response.getContent())
                .sessionId(session.getId())
                .usage(response.getUsage())
                .model(response.getModel())
                .providerId(providerType)
                .estimatedInputTokens(response.getEstimatedInputTokens())
                .estimatedOutputTokens(response.getEstimatedOutputTokens())
                .build());
        } catch (Exception e) {
            log.error("Error sending message: {}", e.getMessage(), e);
            return Result.failure(AIException.from(e));
        }
    }

    private static Integer contextWindowOf(AIProvider provider, String model) {
        List<AIModel> models = provider.getModels().getOrNull();
        if (models == null) {
            return null;
        }
        return models.stream()
            .filter(candidate -> candidate.getId().equals(model))
            .map(candidate -> candidate.getCapabilities().getContextWindow())
            .findFirst()
            .orElse(null);
    }
}
