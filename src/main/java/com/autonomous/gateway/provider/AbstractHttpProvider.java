package com.autonomous.gateway.provider;

import com.autonomous.gateway.error.AIException;
import com.autonomous.gateway.error.NetworkException;
import com.autonomous.gateway.error.ParseException;
import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.model.TimeoutConfig;
import com.autonomous.gateway.model.ValidationResult;
import com.autonomous.gateway.tokenizer.TokenCounter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shared request pipeline for JSON-over-HTTP providers: local input estimate, wire
 * mapping, POST, error-body handling, response mapping and output estimate.
 *
 * @param <C> vendor config variant
 * @param <Q> vendor request body
 * @param <R> vendor response body
 */
public abstract class AbstractHttpProvider<C extends ProviderConfig, Q, R> implements AIProvider {

    protected static final MediaType JSON = MediaType.get("application/json");

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final C config;
    protected final ObjectMapper objectMapper;
    protected final TokenCounter tokenCounter;
    protected final ResponseFormatter formatter;

    private final OkHttpClient httpClient;
    private final Class<R> responseType;

    protected AbstractHttpProvider(OkHttpClient sharedClient, C config, ObjectMapper objectMapper,
                                   TokenCounter tokenCounter, ResponseFormatter formatter, Class<R> responseType) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.tokenCounter = tokenCounter;
        this.formatter = formatter;
        this.responseType = responseType;
        this.httpClient = withTimeouts(sharedClient, config.getTimeout());
    }

    // Derived clients share the connection pool and dispatcher of the shared one.
    private static OkHttpClient withTimeouts(OkHttpClient sharedClient, TimeoutConfig timeout) {
        return sharedClient.newBuilder()
            .connectTimeout(timeout.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
            .readTimeout(timeout.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
            .writeTimeout(timeout.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public C getConfig() {
        return config;
    }

    @Override
    public Result<AIResponse> sendMessage(AIRequest request) {
        String name = getProviderId().getDisplayName();
        try {
            log.info("{} provider: sending message to model {}", name, request.getModel());

            int estimatedInputTokens = tokenCounter.countTokensWithFormatting(
                request.getMessages(), request.getSystemPrompt());
            log.info("Estimated input tokens: {}", estimatedInputTokens);

            Q wireRequest = toWireRequest(request);
            Request.Builder httpRequest = new Request.Builder()
                .url(config.getBaseUrl())
                .post(RequestBody.create(objectMapper.writeValueAsString(wireRequest), JSON));
            applyHeaders(httpRequest);

            try (Response httpResponse = httpClient.newCall(httpRequest.build()).execute()) {
                ResponseBody body = httpResponse.body();
                String bodyText = body != null ? body.string() : "";
                log.info("{} API response status: {}", name, httpResponse.code());

                if (!httpResponse.isSuccessful()) {
                    log.error("{} API error response: {}", name, bodyText);
                    return Result.failure(new NetworkException(describeError(httpResponse.code(), bodyText)));
                }

                AIResponse mapped = fromWireResponse(parseBody(bodyText), request);
                int estimatedOutputTokens = tokenCounter.countTokens(mapped.getContent());
                AIResponse response = mapped.toBuilder()
                    .estimatedInputTokens(estimatedInputTokens)
                    .estimatedOutputTokens(estimatedOutputTokens)
                    .build();

                log.info("Actual tokens - input: {}, output: {}",
                    response.getUsage().getInputTokens(), response.getUsage().getOutputTokens());
                log.info("Estimated tokens - input: {} (diff: {}), output: {} (diff: {})",
                    estimatedInputTokens, response.getUsage().getInputTokens() - estimatedInputTokens,
                    estimatedOutputTokens, response.getUsage().getOutputTokens() - estimatedOutputTokens);
                return Result.success(response);
            }
        } catch (AIException e) {
            log.error("{} provider failed: {}", name, e.getMessage());
            return Result.failure(e);
        } catch (Exception e) {
            log.error("Exception in {} provider: {}", name, e.getMessage(), e);
            return Result.failure(new NetworkException(name + " API error: " + e.getMessage(), e));
        }
    }

    /**
     * Non-blank key and an https endpoint, plus whatever {@link #vendorValidation} adds.
     */
    @Override
    public ValidationResult validateConfig() {
        List<String> errors = new ArrayList<>();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            errors.add("API key is required");
        }
        String baseUrl = config.getBaseUrl();
        if (baseUrl == null || !baseUrl.startsWith("https://")) {
            errors.add("Base URL must use HTTPS");
        }
        vendorValidation(errors);
        return ValidationResult.of(errors);
    }

    protected void vendorValidation(List<String> errors) {
    }

    protected abstract Q toWireRequest(AIRequest request);

    protected abstract AIResponse fromWireResponse(R response, AIRequest request);

    protected abstract void applyHeaders(Request.Builder request);

    /**
     * Pulls the human-readable message out of a vendor error body.
     *
     * @throws Exception when the body is not in the vendor's error shape
     */
    protected abstract String extractErrorMessage(String body) throws Exception;

    private String describeError(int status, String body) {
        String name = getProviderId().getDisplayName();
        try {
            String message = extractErrorMessage(body);
            if (message != null && !message.isBlank()) {
                return name + " API Error: " + message;
            }
        } catch (Exception e) {
            log.debug("Could not parse {} error body: {}", name, e.getMessage());
        }
        return name + " API Error (" + status + "): " + body;
    }

    private R parseBody(String body) {
        try {
            return objectMapper.readValue(body, responseType);
        } catch (JsonProcessingException e) {
            throw new ParseException("Malformed " + getProviderId().getDisplayName()
                + " response: " + e.getOriginalMessage(), e);
        }
    }
}
