package com.autonomous.gateway.provider;

import com.autonomous.gateway.error.UnsupportedProviderException;
import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.provider.claude.ClaudeProvider;
import com.autonomous.gateway.provider.huggingface.HuggingFaceProvider;
import com.autonomous.gateway.provider.openai.OpenAIProvider;
import com.autonomous.gateway.tokenizer.TokenCounter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of provider constructors keyed by type. Claude, OpenAI and HuggingFace are
 * registered up front; all of them share one HTTP client.
 */
@Slf4j
public class DefaultAIProviderFactory implements AIProviderFactory {

    private final Map<ProviderType, Function<ProviderConfig, AIProvider>> creators = new ConcurrentHashMap<>();

    public DefaultAIProviderFactory(OkHttpClient httpClient, ObjectMapper objectMapper, TokenCounter tokenCounter) {
        ResponseFormatter formatter = new ResponseFormatter(objectMapper);

        register(ProviderType.CLAUDE, config -> new ClaudeProvider(
            httpClient, (ProviderConfig.ClaudeConfig) config, objectMapper, tokenCounter, formatter));
        register(ProviderType.OPENAI, config -> new OpenAIProvider(
            httpClient, (ProviderConfig.OpenAIConfig) config, objectMapper, tokenCounter, formatter));
        register(ProviderType.HUGGINGFACE, config -> new HuggingFaceProvider(
            httpClient, (ProviderConfig.HuggingFaceConfig) config, objectMapper, tokenCounter, formatter));
    }

    @Override
    public AIProvider create(ProviderType type, ProviderConfig config) {
        Function<ProviderConfig, AIProvider> creator = creators.get(type);
        if (creator == null) {
            throw new UnsupportedProviderException("Provider " + type + " not registered");
        }
        return creator.apply(config);
    }

    @Override
    public void register(ProviderType type, Function<ProviderConfig, AIProvider> creator) {
        if (creators.put(type, creator) != null) {
            log.info("Replaced provider registration for {}", type);
        }
    }

    @Override
    public boolean isRegistered(ProviderType type) {
        return creators.containsKey(type);
    }
}
