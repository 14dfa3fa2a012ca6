package com.autonomous.gateway.provider.claude;

import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.AIModel;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.ModelCapabilities;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.provider.AbstractHttpProvider;
import com.autonomous.gateway.tokenizer.TokenCounter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.util.List;

/**
 * Anthropic Messages API.
 */
public class ClaudeProvider
    extends AbstractHttpProvider<ProviderConfig.ClaudeConfig, ClaudeApiModels.Request, ClaudeApiModels.Response> {

    private static final List<AIModel> MODELS = List.of(
        model("claude-sonnet-4-5-20250929", "Claude Sonnet 4.5", 8192),
        model("claude-haiku-4-5-20251001", "Claude Haiku 4.5", 8192),
        model("claude-opus-4-1-20250805", "Claude Opus 4.1", 16384)
    );

    private final ClaudeMapper mapper;

    public ClaudeProvider(OkHttpClient httpClient, ProviderConfig.ClaudeConfig config, ObjectMapper objectMapper,
                          TokenCounter tokenCounter, ResponseFormatter formatter) {
        super(httpClient, config, objectMapper, tokenCounter, formatter, ClaudeApiModels.Response.class);
        this.mapper = new ClaudeMapper(formatter);
    }

    @Override
    public ProviderType getProviderId() {
        return ProviderType.CLAUDE;
    }

    @Override
    public Result<List<AIModel>> getModels() {
        return Result.success(MODELS);
    }

    @Override
    protected ClaudeApiModels.Request toWireRequest(AIRequest request) {
        return mapper.toClaudeRequest(request, config);
    }

    @Override
    protected AIResponse fromWireResponse(ClaudeApiModels.Response response, AIRequest request) {
        return mapper.fromClaudeResponse(response, request.getParameters().getResponseFormat());
    }

    @Override
    protected void applyHeaders(Request.Builder request) {
        request.header("x-api-key", config.getApiKey())
            .header("anthropic-version", config.getApiVersion());
    }

    @Override
    protected String extractErrorMessage(String body) throws Exception {
        JsonNode message = objectMapper.readTree(body).path("error").path("message");
        return message.isTextual() ? message.asText() : null;
    }

    private static AIModel model(String id, String name, int maxTokens) {
        return new AIModel(id, name, ProviderType.CLAUDE, ModelCapabilities.builder()
            .supportsVision(false)
            .supportsStreaming(true)
            .maxTokens(maxTokens)
            .contextWindow(200_000)
            .build());
    }
}
