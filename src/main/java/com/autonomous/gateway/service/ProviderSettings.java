package com.autonomous.gateway.service;

import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.TimeoutConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.Map;

/**
 * One provider entry of the credentials file. Unset fields fall back to the vendor defaults.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderSettings {
    private String apiKey;
    private String baseUrl;
    private String defaultModel;
    private String apiVersion;
    private String organization;
    private String projectId;
    private Map<String, String> headers;
    private Long connectTimeoutMs;
    private Long readTimeoutMs;
    private Long writeTimeoutMs;

    public ProviderConfig toConfig(ProviderType type) {
        TimeoutConfig timeout = timeout();
        return switch (type) {
            case CLAUDE -> {
                ProviderConfig.ClaudeConfig.ClaudeConfigBuilder<?, ?> builder = ProviderConfig.ClaudeConfig.builder()
                    .apiKey(apiKey).baseUrl(baseUrl).timeout(timeout);
                if (apiVersion != null) {
                    builder.apiVersion(apiVersion);
                }
                if (defaultModel != null) {
                    builder.defaultModel(defaultModel);
                }
                yield builder.build();
            }
            case OPENAI -> {
                ProviderConfig.OpenAIConfig.OpenAIConfigBuilder<?, ?> builder = ProviderConfig.OpenAIConfig.builder()
                    .apiKey(apiKey).baseUrl(baseUrl).timeout(timeout)
                    .organization(organization).projectId(projectId);
                if (defaultModel != null) {
                    builder.defaultModel(defaultModel);
                }
                yield builder.build();
            }
            case HUGGINGFACE -> {
                ProviderConfig.HuggingFaceConfig.HuggingFaceConfigBuilder<?, ?> builder =
                    ProviderConfig.HuggingFaceConfig.builder().apiKey(apiKey).baseUrl(baseUrl).timeout(timeout);
                if (defaultModel != null) {
                    builder.defaultModel(defaultModel);
                }
                yield builder.build();
            }
            case GEMINI -> {
                ProviderConfig.GeminiConfig.GeminiConfigBuilder<?, ?> builder = ProviderConfig.GeminiConfig.builder()
                    .apiKey(apiKey).baseUrl(baseUrl).timeout(timeout);
                if (defaultModel != null) {
                    builder.defaultModel(defaultModel);
                }
                yield builder.build();
            }
            case CUSTOM -> {
                ProviderConfig.CustomConfig.CustomConfigBuilder<?, ?> builder = ProviderConfig.CustomConfig.builder()
                    .apiKey(apiKey).baseUrl(baseUrl).timeout(timeout);
                if (headers != null) {
                    builder.headers(Map.copyOf(headers));
                }
                if (defaultModel != null) {
                    builder.defaultModel(defaultModel);
                }
                yield builder.build();
            }
        };
    }

    public static ProviderSettings from(ProviderConfig config) {
        ProviderSettings settings = new ProviderSettings();
        settings.setApiKey(config.getApiKey());
        settings.setBaseUrl(config.getBaseUrl());
        settings.setDefaultModel(config.getDefaultModel());
        settings.setConnectTimeoutMs(config.getTimeout().getConnectTimeoutMs());
        settings.setReadTimeoutMs(config.getTimeout().getReadTimeoutMs());
        settings.setWriteTimeoutMs(config.getTimeout().getWriteTimeoutMs());
        if (config instanceof ProviderConfig.ClaudeConfig) {
            settings.setApiVersion(((ProviderConfig.ClaudeConfig) config).getApiVersion());
        } else if (config instanceof ProviderConfig.OpenAIConfig) {
            ProviderConfig.OpenAIConfig openAI = (ProviderConfig.OpenAIConfig) config;
            settings.setOrganization(openAI.getOrganization());
            settings.setProjectId(openAI.getProjectId());
        } else if (config instanceof ProviderConfig.CustomConfig) {
            settings.setHeaders(((ProviderConfig.CustomConfig) config).getHeaders());
        }
        return settings;
    }

    private TimeoutConfig timeout() {
        TimeoutConfig defaults = TimeoutConfig.defaults();
        return TimeoutConfig.builder()
            .connectTimeoutMs(connectTimeoutMs != null ? connectTimeoutMs : defaults.getConnectTimeoutMs())
            .readTimeoutMs(readTimeoutMs != null ? readTimeoutMs : defaults.getReadTimeoutMs())
            .writeTimeoutMs(writeTimeoutMs != null ? writeTimeoutMs : defaults.getWriteTimeoutMs())
            .build();
    }
}
