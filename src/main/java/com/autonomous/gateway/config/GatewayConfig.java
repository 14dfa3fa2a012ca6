package com.autonomous.gateway.config;

import com.autonomous.gateway.provider.AIProviderFactory;
import com.autonomous.gateway.provider.DefaultAIProviderFactory;
import com.autonomous.gateway.tokenizer.JTokkitTokenCounter;
import com.autonomous.gateway.tokenizer.TokenCounter;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class GatewayConfig {

    /**
     * The one HTTP client every provider and scheduler shares. Providers derive their own
     * timeouts from it, keeping its connection pool.
     */
    @Bean
    public OkHttpClient httpClient(
            @Value("${http.client.connect-timeout-ms:10000}") long connectTimeoutMs,
            @Value("${http.client.read-timeout-ms:300000}") long readTimeoutMs,
            @Value("${http.client.write-timeout-ms:300000}") long writeTimeoutMs) {
        return new OkHttpClient.Builder()
            .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
            .writeTimeout(writeTimeoutMs, TimeUnit.MILLISECONDS)
            .build();
    }

    @Bean
    public TokenCounter tokenCounter(@Value("${gateway.tokenizer.model:gpt-4}") String model) {
        return new JTokkitTokenCounter(model);
    }

    @Bean
    public AIProviderFactory aiProviderFactory(OkHttpClient httpClient, ObjectMapper objectMapper,
                                               TokenCounter tokenCounter) {
        return new DefaultAIProviderFactory(httpClient, objectMapper, tokenCounter);
    }
}
