package com.autonomous.gateway.provider.claude;

import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.ContentBlock;
import com.autonomous.gateway.model.FinishReason;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageContent;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.model.ResponseFormat;
import com.autonomous.gateway.model.TokenUsage;
import com.autonomous.gateway.model.ToolUse;
import com.autonomous.gateway.provider.claude.ClaudeApiModels.ApiMessage;
import com.autonomous.gateway.provider.claude.ClaudeApiModels.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts between gateway models and Messages API bodies.
 */
public class ClaudeMapper {

    private final ResponseFormatter formatter;

    public ClaudeMapper(ResponseFormatter formatter) {
        this.formatter = formatter;
    }

    public ClaudeApiModels.Request toClaudeRequest(AIRequest request, ProviderConfig.ClaudeConfig config) {
        List<ApiMessage> messages = new ArrayList<>();
        for (Message message : request.getMessages()) {
            messages.add(new ApiMessage(mapRole(message.getRole()), mapContent(message.getContent())));
        }

        RequestParameters parameters = request.getParameters();
        enhanceLastUserMessage(messages, parameters.getResponseFormat());

        List<ClaudeApiModels.Tool> tools = request.getTools().isEmpty() ? null : request.getTools().stream()
            .map(tool -> new ClaudeApiModels.Tool(tool.getName(), tool.getDescription(), tool.getInputSchema()))
            .collect(Collectors.toList());

        return ClaudeApiModels.Request.builder()
            .model(request.getModel() != null ? request.getModel() : config.getDefaultModel())
            .messages(messages)
            .maxTokens(parameters.getMaxTokens())
            .temperature(parameters.getTemperature())
            .topP(parameters.getTopP())
            .topK(parameters.getTopK())
            .stopSequences(parameters.getStopSequences().isEmpty() ? null : parameters.getStopSequences())
            .system(request.getSystemPrompt())
            .tools(tools)
            .build();
    }

    public AIResponse fromClaudeResponse(ClaudeApiModels.Response response, ResponseFormat format) {
        String text = response.getContent().stream()
            .filter(content -> "text".equals(content.getType()) && content.getText() != null)
            .map(ClaudeApiModels.ResponseContent::getText)
            .findFirst()
            .orElse("");

        ClaudeApiModels.Usage usage = response.getUsage();
        TokenUsage tokenUsage = usage == null
            ? new TokenUsage(0, 0)
            : new TokenUsage(usage.getInputTokens(), usage.getOutputTokens());

        return AIResponse.builder()
            .id(response.getId())
            .content(formatter.processResponse(text, format))
            .model(response.getModel())
            .usage(tokenUsage)
            .finishReason(mapStopReason(response.getStopReason()))
            .metadataEntry("type", Objects.toString(response.getType(), ""))
            .metadataEntry("stop_sequence", Objects.toString(response.getStopSequence(), ""))
            .toolUses(extractToolUses(response))
            .build();
    }

    /**
     * Tool invocations in the reply. Blocks missing an id, a name or an input are skipped.
     */
    public List<ToolUse> extractToolUses(ClaudeApiModels.Response response) {
        return response.getContent().stream()
            .filter(content -> "tool_use".equals(content.getType()))
            .filter(content -> content.getId() != null && content.getName() != null && content.getInput() != null)
            .map(content -> new ToolUse(content.getId(), content.getName(), content.getInput()))
            .collect(Collectors.toList());
    }

    static FinishReason mapStopReason(String reason) {
        if (reason == null) {
            return FinishReason.STOP;
        }
        return switch (reason) {
            case "max_tokens" -> FinishReason.MAX_TOKENS;
            case "tool_use" -> FinishReason.TOOL_USE;
            default -> FinishReason.STOP;
        };
    }

    // Messages API has no system role inside the conversation
    private static String mapRole(MessageRole role) {
        return role == MessageRole.ASSISTANT ? "assistant" : "user";
    }

    private static Object mapContent(MessageContent content) {
        if (content instanceof MessageContent.Structured) {
            List<Block> blocks = new ArrayList<>();
            for (ContentBlock block : ((MessageContent.Structured) content).getBlocks()) {
                blocks.add(mapBlock(block));
            }
            return blocks;
        }
        return content == null ? "" : content.asPlainText();
    }

    private static Block mapBlock(ContentBlock block) {
        if (block instanceof ContentBlock.ToolUseBlock) {
            ContentBlock.ToolUseBlock toolUse = (ContentBlock.ToolUseBlock) block;
            return Block.toolUse(toolUse.getId(), toolUse.getName(), toolUse.getInput());
        }
        if (block instanceof ContentBlock.ToolResultBlock) {
            ContentBlock.ToolResultBlock toolResult = (ContentBlock.ToolResultBlock) block;
            return Block.toolResult(toolResult.getToolUseId(), toolResult.getContent());
        }
        return Block.text(block.asPlainText());
    }

    @SuppressWarnings("unchecked")
    private void enhanceLastUserMessage(List<ApiMessage> messages, ResponseFormat format) {
        if (messages.isEmpty() || format == ResponseFormat.PLAIN_TEXT) {
            return;
        }
        ApiMessage last = messages.get(messages.size() - 1);
        if (!"user".equals(last.getRole())) {
            return;
        }
        if (last.getContent() instanceof String) {
            last.setContent(formatter.enhanceMessage((String) last.getContent(), format));
            return;
        }
        List<Block> blocks = (List<Block>) last.getContent();
        for (int i = blocks.size() - 1; i >= 0; i--) {
            Block block = blocks.get(i);
            if ("text".equals(block.getType())) {
                block.setText(formatter.enhanceMessage(block.getText(), format));
                return;
            }
        }
    }
}
