package com.autonomous.gateway.provider;

import com.autonomous.gateway.error.UnsupportedProviderException;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.provider.claude.ClaudeProvider;
import com.autonomous.gateway.provider.huggingface.HuggingFaceProvider;
import com.autonomous.gateway.provider.openai.OpenAIProvider;
import com.autonomous.gateway.tokenizer.JTokkitTokenCounter;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DefaultAIProviderFactoryTest {

    private DefaultAIProviderFactory factory;

    @BeforeEach
    void setUp() {
        factory = new DefaultAIProviderFactory(new OkHttpClient(), new ObjectMapper(), new JTokkitTokenCounter("gpt-4"));
    }

    @Test
    void shouldCreateBuiltInProviders() {
        AIProvider claude = factory.create(ProviderType.CLAUDE,
            ProviderConfig.ClaudeConfig.builder().apiKey("key").build());
        AIProvider openAI = factory.create(ProviderType.OPENAI,
            ProviderConfig.OpenAIConfig.builder().apiKey("sk-key").build());
        AIProvider huggingFace = factory.create(ProviderType.HUGGINGFACE,
            ProviderConfig.HuggingFaceConfig.builder().apiKey("hf_key").build());

        assertTrue(claude instanceof ClaudeProvider);
        assertTrue(openAI instanceof OpenAIProvider);
        assertTrue(huggingFace instanceof HuggingFaceProvider);
        assertEquals(ProviderType.CLAUDE, claude.getProviderId());
    }

    @Test
    void shouldRejectUnregisteredType() {
        ProviderConfig.GeminiConfig config = ProviderConfig.GeminiConfig.builder().apiKey("g").build();

        assertFalse(factory.isRegistered(ProviderType.GEMINI));
        UnsupportedProviderException error = assertThrows(UnsupportedProviderException.class,
            () -> factory.create(ProviderType.GEMINI, config));
        assertTrue(error.getMessage().contains("GEMINI"));
    }

    @Test
    void shouldRejectMismatchedConfigVariant() {
        ProviderConfig.OpenAIConfig config = ProviderConfig.OpenAIConfig.builder().apiKey("sk-key").build();

        assertThrows(ClassCastException.class, () -> factory.create(ProviderType.CLAUDE, config));
    }

    @Test
    void shouldUseLaterRegistration() {
        AIProvider custom = mock(AIProvider.class);
        factory.register(ProviderType.GEMINI, config -> custom);

        assertTrue(factory.isRegistered(ProviderType.GEMINI));
        assertSame(custom, factory.create(ProviderType.GEMINI, ProviderConfig.GeminiConfig.builder().build()));
    }
}
