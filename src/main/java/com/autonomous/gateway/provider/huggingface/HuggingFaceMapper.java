package com.autonomous.gateway.provider.huggingface;

import com.autonomous.gateway.error.ParseException;
import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.FinishReason;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.model.ResponseFormat;
import com.autonomous.gateway.model.TokenUsage;
import com.autonomous.gateway.provider.huggingface.HuggingFaceApiModels.ApiMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps to and from the router's chat format. Reasoning models wrap their chain of
 * thought in {@code <think>} tags; it is moved into metadata and shown ahead of the answer.
 */
public class HuggingFaceMapper {

    static final String REASONING_HEADER = "Model reasoning:";
    static final String REASONING_DELIMITER = "----------------";

    private static final Pattern THINK = Pattern.compile("<think>(.*?)</think>", Pattern.DOTALL);

    private final ResponseFormatter formatter;

    public HuggingFaceMapper(ResponseFormatter formatter) {
        this.formatter = formatter;
    }

    public HuggingFaceApiModels.Request toHuggingFaceRequest(AIRequest request,
                                                            ProviderConfig.HuggingFaceConfig config) {
        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null) {
            messages.add(new ApiMessage("system", request.getSystemPrompt()));
        }
        for (Message message : request.getMessages()) {
            messages.add(new ApiMessage(mapRole(message.getRole()), message.getText()));
        }

        RequestParameters parameters = request.getParameters();
        ApiMessage last = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        if (last != null && "user".equals(last.getRole())) {
            last.setContent(formatter.enhanceMessage(last.getContent(), parameters.getResponseFormat()));
        }

        return HuggingFaceApiModels.Request.builder()
            .model(request.getModel() != null ? request.getModel() : config.getDefaultModel())
            .messages(messages)
            .temperature(parameters.getTemperature())
            .maxTokens(parameters.getMaxTokens())
            .topP(parameters.getTopP())
            .stop(parameters.getStopSequences().isEmpty() ? null : parameters.getStopSequences())
            .build();
    }

    public AIResponse fromHuggingFaceResponse(HuggingFaceApiModels.Response response, ResponseFormat format) {
        if (response.getChoices() == null || response.getChoices().isEmpty()) {
            throw new ParseException("No choices in HuggingFace response");
        }
        HuggingFaceApiModels.Choice choice = response.getChoices().get(0);
        String raw = choice.getMessage() == null || choice.getMessage().getContent() == null
            ? "" : choice.getMessage().getContent();

        String reasoning = extractReasoning(raw);
        String answer = formatter.processResponse(removeReasoning(raw), format);

        HuggingFaceApiModels.Usage usage = response.getUsage();
        TokenUsage tokenUsage = usage == null
            ? new TokenUsage(0, 0)
            : new TokenUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());

        AIResponse.AIResponseBuilder builder = AIResponse.builder()
            .id(response.getId() != null ? response.getId() : "hf-" + System.currentTimeMillis())
            .model(response.getModel())
            .usage(tokenUsage)
            .finishReason(mapFinishReason(choice.getFinishReason()));

        if (reasoning.isEmpty()) {
            return builder.content(answer).build();
        }
        String content = REASONING_HEADER + "\n"
            + REASONING_DELIMITER + "\n"
            + reasoning + "\n"
            + REASONING_DELIMITER + "\n\n"
            + answer;
        return builder.content(content).metadataEntry("reasoning", reasoning).build();
    }

    static String extractReasoning(String content) {
        Matcher matcher = THINK.matcher(content);
        List<String> parts = new ArrayList<>();
        while (matcher.find()) {
            parts.add(matcher.group(1).trim());
        }
        return String.join("\n\n", parts);
    }

    static String removeReasoning(String content) {
        return THINK.matcher(content).replaceAll("").trim();
    }

    static FinishReason mapFinishReason(String reason) {
        if (reason == null) {
            return FinishReason.STOP;
        }
        return switch (reason) {
            case "length" -> FinishReason.MAX_TOKENS;
            case "content_filter" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }

    private static String mapRole(MessageRole role) {
        return switch (role) {
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case SYSTEM -> "system";
        };
    }
}
