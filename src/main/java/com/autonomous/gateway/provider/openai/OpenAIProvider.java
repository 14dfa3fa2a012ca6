package com.autonomous.gateway.provider.openai;

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

public class OpenAIProvider
    extends AbstractHttpProvider<ProviderConfig.OpenAIConfig, OpenAIApiModels.Request, OpenAIApiModels.Response> {

    private static final List<AIModel> MODELS = List.of(
        model("gpt-5-nano", false, 4096, 128_000),
        model("gpt-5-mini", false, 8192, 128_000),
        model("gpt-5", true, 16384, 200_000),
        model("gpt-5-pro", true, 32768, 200_000)
    );

    private final OpenAIMapper mapper;

    public OpenAIProvider(OkHttpClient httpClient, ProviderConfig.OpenAIConfig config, ObjectMapper objectMapper,
                          TokenCounter tokenCounter, ResponseFormatter formatter) {
        super(httpClient, config, objectMapper, tokenCounter, formatter, OpenAIApiModels.Response.class);
        this.mapper = new OpenAIMapper(formatter, objectMapper);
    }

    @Override
    public ProviderType getProviderId() {
        return ProviderType.OPENAI;
    }

    @Override
    public Result<List<AIModel>> getModels() {
        return Result.success(MODELS);
    }

    @Override
    protected OpenAIApiModels.Request toWireRequest(AIRequest request) {
        return mapper.toOpenAIRequest(request, config);
    }

    @Override
    protected AIResponse fromWireResponse(OpenAIApiModels.Response response, AIRequest request) {
        return mapper.fromOpenAIResponse(response, request.getParameters().getResponseFormat());
    }

    @Override
    protected void applyHeaders(Request.Builder request) {
        request.header("Authorization", "Bearer " + config.getApiKey());
        if (config.getOrganization() != null) {
            request.header("OpenAI-Organization", config.getOrganization());
        }
        if (config.getProjectId() != null) {
            request.header("OpenAI-Project", config.getProjectId());
        }
    }

    @Override
    protected String extractErrorMessage(String body) throws Exception {
        JsonNode message = objectMapper.readTree(body).path("error").path("message");
        return message.isTextual() ? message.asText() : null;
    }

    @Override
    protected void vendorValidation(List<String> errors) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("sk-")) {
            errors.add("Invalid API key format (should start with 'sk-')");
        }
    }

    private static AIModel model(String id, boolean vision, int maxTokens, int contextWindow) {
        return new AIModel(id, id, ProviderType.OPENAI, ModelCapabilities.builder()
            .supportsVision(vision)
            .supportsStreaming(true)
            .maxTokens(maxTokens)
            .contextWindow(contextWindow)
            .build());
    }
}
