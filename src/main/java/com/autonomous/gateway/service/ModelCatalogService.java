package com.autonomous.gateway.service;

import com.autonomous.gateway.error.AIException;
import com.autonomous.gateway.model.AIModel;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.provider.AIProviderFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class ModelCatalogService {

    private final AIProviderFactory providerFactory;
    private final ProviderConfigRepository configRepository;

    public ModelCatalogService(AIProviderFactory providerFactory, ProviderConfigRepository configRepository) {
        this.providerFactory = providerFactory;
        this.configRepository = configRepository;
    }

    public Result<List<AIModel>> getModels(ProviderType providerType) {
        try {
            return providerFactory.create(providerType, configRepository.getProviderConfig(providerType)).getModels();
        } catch (Exception e) {
            log.warn("Cannot list models for {}: {}", providerType.getId(), e.getMessage());
            return Result.failure(AIException.from(e));
        }
    }
}
