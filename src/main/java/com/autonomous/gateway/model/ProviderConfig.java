package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Map;

/**
 * Credentials and endpoint for one provider. A config instance belongs to exactly one
 * provider instance and is never mutated after construction.
 */
@Getter
@SuperBuilder(toBuilder = true)
@ToString
public abstract class ProviderConfig {

    @ToString.Exclude
    private final String apiKey;

    private final String baseUrl;

    @Builder.Default
    private final TimeoutConfig timeout = TimeoutConfig.defaults();

    public abstract ProviderType getType();

    public abstract String getDefaultModel();

    /** Vendor endpoint used when no base URL was configured; may be null. */
    protected abstract String defaultBaseUrl();

    public String getBaseUrl() {
        return baseUrl != null ? baseUrl : defaultBaseUrl();
    }

    @Getter
    @SuperBuilder(toBuilder = true)
    @ToString(callSuper = true)
    public static class ClaudeConfig extends ProviderConfig {
        public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1/messages";

        @Builder.Default
        private final String apiVersion = "2023-06-01";
        @Builder.Default
        private final String defaultModel = "claude-sonnet-4-5-20250929";

        @Override
        public ProviderType getType() {
            return ProviderType.CLAUDE;
        }

        @Override
        protected String defaultBaseUrl() {
            return DEFAULT_BASE_URL;
        }
    }

    @Getter
    @SuperBuilder(toBuilder = true)
    @ToString(callSuper = true)
    public static class OpenAIConfig extends ProviderConfig {
        public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1/chat/completions";

        private final String organization;
        private final String projectId;
        @Builder.Default
        private final String defaultModel = "gpt-4-turbo";

        @Override
        public ProviderType getType() {
            return ProviderType.OPENAI;
        }

        @Override
        protected String defaultBaseUrl() {
            return DEFAULT_BASE_URL;
        }
    }

    @Getter
    @SuperBuilder(toBuilder = true)
    @ToString(callSuper = true)
    public static class HuggingFaceConfig extends ProviderConfig {
        public static final String DEFAULT_BASE_URL = "https://router.huggingface.co/v1/chat/completions";

        @Builder.Default
        private final String defaultModel = "deepseek-ai/DeepSeek-R1:fastest";

        @Override
        public ProviderType getType() {
            return ProviderType.HUGGINGFACE;
        }

        @Override
        protected String defaultBaseUrl() {
            return DEFAULT_BASE_URL;
        }
    }

    @Getter
    @SuperBuilder(toBuilder = true)
    @ToString(callSuper = true)
    public static class GeminiConfig extends ProviderConfig {
        public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1";

        @Builder.Default
        private final String defaultModel = "gemini-pro";

        @Override
        public ProviderType getType() {
            return ProviderType.GEMINI;
        }

        @Override
        protected String defaultBaseUrl() {
            return DEFAULT_BASE_URL;
        }
    }

    @Getter
    @SuperBuilder(toBuilder = true)
    @ToString(callSuper = true)
    public static class CustomConfig extends ProviderConfig {
        @Builder.Default
        private final Map<String, String> headers = Map.of();
        @Builder.Default
        private final String defaultModel = "default";

        @Override
        public ProviderType getType() {
            return ProviderType.CUSTOM;
        }

        @Override
        protected String defaultBaseUrl() {
            return null;
        }
    }
}
