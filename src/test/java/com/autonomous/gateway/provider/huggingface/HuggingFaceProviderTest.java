package com.autonomous.gateway.provider.huggingface;

import com.autonomous.gateway.error.NetworkException;
import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.FinishReason;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.tokenizer.JTokkitTokenCounter;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class HuggingFaceProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private HuggingFaceProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = provider("hf_test", server.url("/v1/chat/completions").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private HuggingFaceProvider provider(String apiKey, String baseUrl) {
        ProviderConfig.HuggingFaceConfig config = ProviderConfig.HuggingFaceConfig.builder()
            .apiKey(apiKey)
            .baseUrl(baseUrl)
            .build();
        return new HuggingFaceProvider(new OkHttpClient(), config, objectMapper,
            new JTokkitTokenCounter("gpt-4"), new ResponseFormatter(objectMapper));
    }

    private static AIRequest request() {
        return AIRequest.builder().message(Message.of(MessageRole.USER, "What is 2+2?")).build();
    }

    private static String body(String id, String content) {
        String idField = id == null ? "" : "\"id\":\"" + id + "\",";
        return "{" + idField + "\"model\":\"deepseek-ai/DeepSeek-R1\",\"choices\":[{\"index\":0,"
            + "\"message\":{\"role\":\"assistant\",\"content\":\"" + content + "\"},\"finish_reason\":\"stop\"}],"
            + "\"usage\":{\"prompt_tokens\":8,\"completion_tokens\":20,\"total_tokens\":28}}";
    }

    @Test
    void shouldMoveReasoningAheadOfAnswer() throws Exception {
        server.enqueue(new MockResponse().setBody(body("hf-1", "<think>Two plus two.</think>\\n\\nThe answer is 4.")));

        AIResponse response = provider.sendMessage(request()).getValue();

        assertEquals("Two plus two.", response.getMetadata().get("reasoning"));
        assertEquals("Model reasoning:\n----------------\nTwo plus two.\n----------------\n\nThe answer is 4.",
            response.getContent());
        assertEquals(FinishReason.STOP, response.getFinishReason());
        assertEquals("Bearer hf_test", server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void shouldReturnPlainAnswerWithoutReasoning() {
        server.enqueue(new MockResponse().setBody(body("hf-2", "4")));

        AIResponse response = provider.sendMessage(request()).getValue();

        assertEquals("4", response.getContent());
        assertFalse(response.getMetadata().containsKey("reasoning"));
        assertEquals("deepseek-ai/DeepSeek-R1", response.getModel());
    }

    @Test
    void shouldGenerateIdWhenMissing() {
        server.enqueue(new MockResponse().setBody(body(null, "4")));

        AIResponse response = provider.sendMessage(request()).getValue();

        assertTrue(response.getId().startsWith("hf-"));
    }

    @Test
    void shouldReportStringErrorBody() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"error\":\"Model is loading\"}"));

        Result<AIResponse> result = provider.sendMessage(request());

        assertTrue(result.getError() instanceof NetworkException);
        assertEquals("HuggingFace API Error: Model is loading", result.getError().getMessage());
    }

    @Test
    void shouldJoinMultipleReasoningSections() {
        String content = "<think>first</think>middle<think>\n second \n</think>end";

        assertEquals("first\n\nsecond", HuggingFaceMapper.extractReasoning(content));
        assertEquals("middleend", HuggingFaceMapper.removeReasoning(content));
        assertEquals("", HuggingFaceMapper.extractReasoning("no tags"));
    }

    @Test
    void shouldRejectKeyWithoutHfPrefix() {
        assertFalse(provider("abc", null).validateConfig().isValid());
        assertTrue(provider("hf_abc", null).validateConfig().isValid());
    }

    @Test
    void shouldListCatalog() {
        assertEquals(5, provider.getModels().getValue().size());
        assertEquals(2048, provider.getModels().getValue().get(4).getCapabilities().getMaxTokens());
    }
}
