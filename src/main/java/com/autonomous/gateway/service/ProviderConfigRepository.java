package com.autonomous.gateway.service;

import com.autonomous.gateway.error.ConfigurationException;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider credentials, loaded from a YAML file keyed by provider id:
 * <pre>
 * claude:
 *   api_key: ...
 *   default_model: claude-sonnet-4-5-20250929
 * openai:
 *   api_key: sk-...
 * </pre>
 */
@Slf4j
@Service
public class ProviderConfigRepository {

    private static final TypeReference<Map<String, ProviderSettings>> FILE_TYPE = new TypeReference<>() {
    };

    @Value("${gateway.providers.path:config/providers.yaml}")
    private String configPath;

    private final Map<ProviderType, ProviderConfig> configs = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public ProviderConfigRepository() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadConfigs() {
        configs.clear();
        File file = new File(configPath);

        if (!file.isFile()) {
            log.warn("Provider config file not found: {}", configPath);
            return;
        }

        Map<String, ProviderSettings> entries;
        try {
            entries = yamlMapper.readValue(file, FILE_TYPE);
        } catch (IOException e) {
            log.error("Failed to read provider config {}: {}", configPath, e.getMessage());
            return;
        }
        if (entries == null) {
            return;
        }

        entries.forEach((id, settings) -> {
            Optional<ProviderType> type = ProviderType.fromId(id);
            if (type.isEmpty()) {
                log.warn("Skipping unknown provider '{}' in {}", id, configPath);
                return;
            }
            if (settings == null) {
                log.warn("Skipping empty entry for provider '{}'", id);
                return;
            }
            configs.put(type.get(), settings.toConfig(type.get()));
            log.info("Loaded config for provider: {}", type.get().getId());
        });
    }

    /**
     * @throws ConfigurationException when the provider has no config
     */
    public ProviderConfig getProviderConfig(ProviderType type) {
        return findProviderConfig(type)
            .orElseThrow(() -> new ConfigurationException("Provider " + type.getId() + " is not configured"));
    }

    public Optional<ProviderConfig> findProviderConfig(ProviderType type) {
        return Optional.ofNullable(configs.get(type));
    }

    public Set<ProviderType> getConfiguredProviders() {
        return Set.copyOf(configs.keySet());
    }

    public void saveProviderConfig(ProviderConfig config) {
        configs.put(config.getType(), config);
        log.info("Saved config for provider: {}", config.getType().getId());
        writeFile();
    }

    public boolean removeProviderConfig(ProviderType type) {
        boolean removed = configs.remove(type) != null;
        if (removed) {
            log.info("Removed config for provider: {}", type.getId());
            writeFile();
        }
        return removed;
    }

    private void writeFile() {
        Map<String, ProviderSettings> entries = new LinkedHashMap<>();
        new TreeMap<>(configs).forEach((type, config) -> entries.put(type.getId(), ProviderSettings.from(config)));
        File file = new File(configPath);
        try {
            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null) {
                parent.mkdirs();
            }
            yamlMapper.writeValue(file, entries);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write provider config " + configPath + ": " + e.getMessage());
        }
    }
}
