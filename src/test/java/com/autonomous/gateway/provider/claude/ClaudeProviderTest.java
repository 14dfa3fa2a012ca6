package com.autonomous.gateway.provider.claude;

import com.autonomous.gateway.error.NetworkException;
import com.autonomous.gateway.error.ParseException;
import com.autonomous.gateway.format.ResponseFormatter;
import com.autonomous.gateway.model.AIRequest;
import com.autonomous.gateway.model.AIResponse;
import com.autonomous.gateway.model.FinishReason;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.model.ResponseFormat;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.model.TimeoutConfig;
import com.autonomous.gateway.model.ValidationResult;
import com.autonomous.gateway.tokenizer.JTokkitTokenCounter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeProviderTest {

    private static final String SUCCESS_BODY = "{"
        + "\"id\":\"msg_01\",\"type\":\"message\",\"role\":\"assistant\","
        + "\"content\":[{\"type\":\"text\",\"text\":\"Hello there\"}],"
        + "\"model\":\"claude-haiku-4-5-20251001\",\"stop_reason\":\"end_turn\",\"stop_sequence\":null,"
        + "\"usage\":{\"input_tokens\":12,\"output_tokens\":3}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ClaudeProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = providerFor(server.url("/v1/messages").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private ClaudeProvider providerFor(String baseUrl) {
        ProviderConfig.ClaudeConfig config = ProviderConfig.ClaudeConfig.builder()
            .apiKey("test-key")
            .baseUrl(baseUrl)
            .timeout(TimeoutConfig.builder().connectTimeoutMs(1000).readTimeoutMs(2000).writeTimeoutMs(2000).build())
            .build();
        return new ClaudeProvider(new OkHttpClient(), config, objectMapper, new JTokkitTokenCounter("gpt-4"),
            new ResponseFormatter(objectMapper));
    }

    private static AIRequest simpleRequest() {
        return AIRequest.builder()
            .message(Message.of(MessageRole.USER, "Hi"))
            .model("claude-haiku-4-5-20251001")
            .build();
    }

    @Test
    void shouldSendAuthHeadersAndMapResponse() throws Exception {
        server.enqueue(new MockResponse().setBody(SUCCESS_BODY));

        Result<AIResponse> result = provider.sendMessage(simpleRequest());

        assertTrue(result.isSuccess());
        AIResponse response = result.getValue();
        assertEquals("msg_01", response.getId());
        assertEquals("Hello there", response.getContent());
        assertEquals(FinishReason.STOP, response.getFinishReason());
        assertEquals(12, response.getUsage().getInputTokens());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertEquals("message", response.getMetadata().get("type"));
        assertEquals("", response.getMetadata().get("stop_sequence"));

        RecordedRequest recorded = server.takeRequest();
        assertEquals("POST", recorded.getMethod());
        assertEquals("test-key", recorded.getHeader("x-api-key"));
        assertEquals("2023-06-01", recorded.getHeader("anthropic-version"));
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"));
    }

    @Test
    void shouldKeepEstimatedAndReportedUsageApart() {
        server.enqueue(new MockResponse().setBody(SUCCESS_BODY));

        AIResponse response = provider.sendMessage(simpleRequest()).getValue();

        assertTrue(response.getEstimatedInputTokens() > 0);
        assertTrue(response.getEstimatedOutputTokens() > 0);
        assertEquals(12, response.getUsage().getInputTokens());
        assertEquals(3, response.getUsage().getOutputTokens());
    }

    @Test
    void shouldFoldSystemRoleIntoUserAndPreserveOrder() throws Exception {
        server.enqueue(new MockResponse().setBody(SUCCESS_BODY));
        AIRequest request = AIRequest.builder()
            .message(Message.of(MessageRole.SYSTEM, "context"))
            .message(Message.of(MessageRole.USER, "first"))
            .message(Message.of(MessageRole.ASSISTANT, "answer"))
            .message(Message.of(MessageRole.USER, "second"))
            .model("claude-haiku-4-5-20251001")
            .systemPrompt("Be brief")
            .build();

        provider.sendMessage(request);

        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        JsonNode messages = body.get("messages");
        assertEquals(4, messages.size());
        assertEquals("user", messages.get(0).get("role").asText());
        assertEquals("context", messages.get(0).get("content").asText());
        assertEquals("assistant", messages.get(2).get("role").asText());
        assertEquals("second", messages.get(3).get("content").asText());
        assertEquals("Be brief", body.get("system").asText());
        assertEquals(4096, body.get("max_tokens").asInt());
        assertFalse(body.has("stop_sequences"));
    }

    @Test
    void shouldEnhanceLastUserMessageAndCleanJsonReply() throws Exception {
        String reply = "```json\\n{\\\"title\\\":\\\"t\\\",\\\"source_request\\\":\\\"q\\\",\\\"answer\\\":\\\"a\\\"}\\n```";
        server.enqueue(new MockResponse().setBody(SUCCESS_BODY.replace("Hello there", reply)));
        AIRequest request = simpleRequest().toBuilder()
            .parameters(RequestParameters.builder().responseFormat(ResponseFormat.JSON).build())
            .build();

        AIResponse response = provider.sendMessage(request).getValue();

        String sent = objectMapper.readTree(server.takeRequest().getBody().readUtf8())
            .get("messages").get(0).get("content").asText();
        assertTrue(sent.startsWith("User request: Hi"));
        assertEquals("a", objectMapper.readTree(response.getContent()).get("answer").asText());
    }

    @Test
    void shouldExtractOnlyCompleteToolUseBlocks() {
        String body = "{\"id\":\"msg_02\",\"type\":\"message\",\"role\":\"assistant\",\"content\":["
            + "{\"type\":\"text\",\"text\":\"Checking the weather\"},"
            + "{\"type\":\"tool_use\",\"id\":\"tu_1\",\"name\":\"get_weather\",\"input\":{\"city\":\"Paris\"}},"
            + "{\"type\":\"tool_use\",\"id\":\"tu_2\",\"input\":{}}],"
            + "\"model\":\"claude-haiku-4-5-20251001\",\"stop_reason\":\"tool_use\","
            + "\"usage\":{\"input_tokens\":20,\"output_tokens\":10}}";
        server.enqueue(new MockResponse().setBody(body));

        AIResponse response = provider.sendMessage(simpleRequest()).getValue();

        assertEquals(FinishReason.TOOL_USE, response.getFinishReason());
        assertEquals(1, response.getToolUses().size());
        assertEquals("get_weather", response.getToolUses().get(0).getName());
        assertEquals("Paris", response.getToolUses().get(0).getInput().get("city").asText());
        assertEquals("Checking the weather", response.getContent());
    }

    @Test
    void shouldReportVendorErrorMessage() {
        server.enqueue(new MockResponse().setResponseCode(400)
            .setBody("{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\",\"message\":\"max_tokens too large\"}}"));

        Result<AIResponse> result = provider.sendMessage(simpleRequest());

        assertTrue(result.getError() instanceof NetworkException);
        assertEquals("Anthropic Claude API Error: max_tokens too large", result.getError().getMessage());
    }

    @Test
    void shouldFallBackToStatusAndRawBody() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream unavailable"));

        Result<AIResponse> result = provider.sendMessage(simpleRequest());

        assertTrue(result.getError() instanceof NetworkException);
        assertEquals("Anthropic Claude API Error (503): upstream unavailable", result.getError().getMessage());
    }

    @Test
    void shouldReportMalformedSuccessBodyAsParseError() {
        server.enqueue(new MockResponse().setBody("<html>not json</html>"));

        Result<AIResponse> result = provider.sendMessage(simpleRequest());

        assertTrue(result.getError() instanceof ParseException);
    }

    @Test
    void shouldReturnFailureWhenServerUnreachable() throws IOException {
        String url = server.url("/v1/messages").toString();
        server.shutdown();

        Result<AIResponse> result = assertDoesNotThrow(() -> providerFor(url).sendMessage(simpleRequest()));

        assertTrue(result.getError() instanceof NetworkException);
    }

    @Test
    void shouldValidateConfig() {
        ClaudeProvider valid = new ClaudeProvider(new OkHttpClient(),
            ProviderConfig.ClaudeConfig.builder().apiKey("key").build(), objectMapper,
            new JTokkitTokenCounter("gpt-4"), new ResponseFormatter(objectMapper));
        ClaudeProvider invalid = new ClaudeProvider(new OkHttpClient(),
            ProviderConfig.ClaudeConfig.builder().apiKey(" ").baseUrl("http://insecure").build(), objectMapper,
            new JTokkitTokenCounter("gpt-4"), new ResponseFormatter(objectMapper));

        assertTrue(valid.validateConfig().isValid());
        ValidationResult result = invalid.validateConfig();
        assertFalse(result.isValid());
        assertEquals(2, result.getErrors().size());
    }

    @Test
    void shouldListStaticCatalog() {
        assertEquals(3, provider.getModels().getValue().size());
        assertEquals(200_000, provider.getModels().getValue().get(0).getCapabilities().getContextWindow());
    }
}
