package com.autonomous.gateway.provider.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire bodies of the Anthropic Messages API.
 */
public final class ClaudeApiModels {

    private ClaudeApiModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Request {
        private String model;
        private List<ApiMessage> messages;
        private int maxTokens;
        private double temperature;
        private double topP;
        private Integer topK;
        private List<String> stopSequences;
        private String system;
        private List<Tool> tools;
    }

    /**
     * {@code content} is either a String or a list of {@link Block}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiMessage {
        private String role;
        private Object content;
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Block {
        private String type;
        private String text;
        private String id;
        private String name;
        private JsonNode input;
        private String toolUseId;
        private String content;

        public static Block text(String text) {
            Block block = new Block();
            block.setType("text");
            block.setText(text);
            return block;
        }

        public static Block toolUse(String id, String name, JsonNode input) {
            Block block = new Block();
            block.setType("tool_use");
            block.setId(id);
            block.setName(name);
            block.setInput(input);
            return block;
        }

        public static Block toolResult(String toolUseId, String content) {
            Block block = new Block();
            block.setType("tool_result");
            block.setToolUseId(toolUseId);
            block.setContent(content);
            return block;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Tool {
        private String name;
        private String description;
        private JsonNode inputSchema;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Response {
        private String id;
        private String type;
        private String role;
        private List<ResponseContent> content = new ArrayList<>();
        private String model;
        private String stopReason;
        private String stopSequence;
        private Usage usage;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseContent {
        private String type;
        private String text;
        private String id;
        private String name;
        private JsonNode input;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Usage {
        private int inputTokens;
        private int outputTokens;
    }
}
