package com.autonomous.gateway.provider.huggingface;

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
 * HuggingFace inference router, OpenAI-compatible chat endpoint.
 */
public class HuggingFaceProvider extends AbstractHttpProvider<ProviderConfig.HuggingFaceConfig,
    HuggingFaceApiModels.Request, HuggingFaceApiModels.Response> {

    private static final List<AIModel> MODELS = List.of(
        model("deepseek-ai/DeepSeek-R1:fastest", "DeepSeek R1 (Fastest)", 8192, 128_000),
        model("deepseek-ai/DeepSeek-R1", "DeepSeek R1", 8192, 128_000),
        model("meta-llama/Llama-3.3-70B-Instruct", "Llama 3.3 70B Instruct", 8192, 128_000),
        model("Qwen/Qwen2.5-72B-Instruct", "Qwen 2.5 72B Instruct", 8192, 32_768),
        model("meta-llama/Llama-3.2-3B-Instruct", "Llama 3.2 3B Instruct", 2048, 128_000)
    );

    private final HuggingFaceMapper mapper;

    public HuggingFaceProvider(OkHttpClient httpClient, ProviderConfig.HuggingFaceConfig config,
                               ObjectMapper objectMapper, TokenCounter tokenCounter, ResponseFormatter formatter) {
        super(httpClient, config, objectMapper, tokenCounter, formatter, HuggingFaceApiModels.Response.class);
        this.mapper = new HuggingFaceMapper(formatter);
    }

    @Override
    public ProviderType getProviderId() {
        return ProviderType.HUGGINGFACE;
    }

    @Override
    public Result<List<AIModel>> getModels() {
        return Result.success(MODELS);
    }

    @Override
    protected HuggingFaceApiModels.Request toWireRequest(AIRequest request) {
        return mapper.toHuggingFaceRequest(request, config);
    }

    @Override
    protected AIResponse fromWireResponse(HuggingFaceApiModels.Response response, AIRequest request) {
        return mapper.fromHuggingFaceResponse(response, request.getParameters().getResponseFormat());
    }

    @Override
    protected void applyHeaders(Request.Builder request) {
        request.header("Authorization", "Bearer " + config.getApiKey());
    }

    /**
     * The router answers either {@code {"error": "..."}} or the OpenAI nested shape.
     */
    @Override
    protected String extractErrorMessage(String body) throws Exception {
        JsonNode error = objectMapper.readTree(body).path("error");
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode message = error.path("message");
        return message.isTextual() ? message.asText() : null;
    }

    @Override
    protected void vendorValidation(List<String> errors) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("hf_")) {
            errors.add("Invalid API key format (should start with 'hf_')");
        }
    }

    private static AIModel model(String id, String name, int maxTokens, int contextWindow) {
        return new AIModel(id, name, ProviderType.HUGGINGFACE, ModelCapabilities.builder()
            .supportsVision(false)
            .supportsStreaming(true)
            .maxTokens(maxTokens)
            .contextWindow(contextWindow)
            .build());
    }
}
