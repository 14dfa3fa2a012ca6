package com.autonomous.gateway.provider;

import com.autonomous.gateway.model.AIModel;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.model.ValidationResult;

import java.util.List;

/**
 * Adapter for one vendor's chat API. Implementations never throw from these methods;
 * every failure comes back as a {@link Result} failure or an invalid {@link ValidationResult}.
 */
public interface AIProvider {

    ProviderType getProviderId();

    ProviderConfig getConfig();

    Result<AIResponse> sendMessage(AIRequest request);

    Result<List<AIModel>> getModels();

    ValidationResult validateConfig();
}
