package com.autonomous.gateway.provider.openai;

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
import com.autonomous.gateway.model.ToolUse;
import com.autonomous.gateway.provider.openai.OpenAIApiModels.ApiMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
public class OpenAIMapper {

    private final ResponseFormatter formatter;
    private final ObjectMapper objectMapper;

    public OpenAIMapper(ResponseFormatter formatter, ObjectMapper objectMapper) {
        this.formatter = formatter;
        this.objectMapper = objectMapper;
    }

    public OpenAIApiModels.Request toOpenAIRequest(AIRequest request, ProviderConfig.OpenAIConfig config) {
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

        String model = request.getModel() != null ? request.getModel() : config.getDefaultModel();
        // gpt-5 family rejects max_tokens
        boolean completionTokens = model.startsWith("gpt-5");

        List<OpenAIApiModels.Tool> tools = request.getTools().isEmpty() ? null : request.getTools().stream()
            .map(tool -> OpenAIApiModels.Tool.function(tool.getName(), tool.getDescription(), tool.getInputSchema()))
            .collect(Collectors.toList());

        return OpenAIApiModels.Request.builder()
            .model(model)
            .messages(messages)
            .temperature(parameters.getTemperature())
            .maxTokens(completionTokens ? null : parameters.getMaxTokens())
            .maxCompletionTokens(completionTokens ? parameters.getMaxTokens() : null)
            .topP(parameters.getTopP())
            .frequencyPenalty(parameters.getFrequencyPenalty())
            .presencePenalty(parameters.getPresencePenalty())
            .stop(parameters.getStopSequences().isEmpty() ? null : parameters.getStopSequences())
            .tools(tools)
            .build();
    }

    public AIResponse fromOpenAIResponse(OpenAIApiModels.Response response, ResponseFormat format) {
        if (response.getChoices() == null || response.getChoices().isEmpty()) {
            throw new ParseException("No choices in OpenAI response");
        }
        OpenAIApiModels.Choice choice = response.getChoices().get(0);
        OpenAIApiModels.ResponseMessage message = choice.getMessage();
        String text = message == null || message.getContent() == null ? "" : message.getContent();

        OpenAIApiModels.Usage usage = response.getUsage();
        TokenUsage tokenUsage = usage == null
            ? new TokenUsage(0, 0)
            : new TokenUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());

        return AIResponse.builder()
            .id(response.getId())
            .content(formatter.processResponse(text, format))
            .model(response.getModel())
            .usage(tokenUsage)
            .finishReason(mapFinishReason(choice.getFinishReason()))
            .metadataEntry("created", String.valueOf(response.getCreated()))
            .metadataEntry("system_fingerprint", Objects.toString(response.getSystemFingerprint(), ""))
            .toolUses(message == null ? List.of() : extractToolUses(message))
            .build();
    }

    /**
     * Function calls in the reply. Calls whose arguments are not valid JSON are skipped.
     */
    List<ToolUse> extractToolUses(OpenAIApiModels.ResponseMessage message) {
        List<ToolUse> toolUses = new ArrayList<>();
        if (message.getToolCalls() == null) {
            return toolUses;
        }
        for (OpenAIApiModels.ToolCall call : message.getToolCalls()) {
            OpenAIApiModels.FunctionCall function = call.getFunction();
            if (call.getId() == null || function == null || function.getName() == null
                || function.getArguments() == null) {
                continue;
            }
            try {
                toolUses.add(new ToolUse(call.getId(), function.getName(), objectMapper.readTree(function.getArguments())));
            } catch (JsonProcessingException e) {
                log.warn("Dropping tool call {} with unparsable arguments: {}", call.getId(), e.getOriginalMessage());
            }
        }
        return toolUses;
    }

    static FinishReason mapFinishReason(String reason) {
        if (reason == null) {
            return FinishReason.STOP;
        }
        return switch (reason) {
            case "length" -> FinishReason.MAX_TOKENS;
            case "content_filter" -> FinishReason.CONTENT_FILTER;
            case "tool_calls" -> FinishReason.TOOL_USE;
            default -> FinishReason.STOP;
        };
    }

    static String mapRole(MessageRole role) {
        return switch (role) {
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case SYSTEM -> "system";
        };
    }
}
