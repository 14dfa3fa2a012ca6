package com.autonomous.gateway.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Value;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContentBlock.TextBlock.class, name = "text"),
    @JsonSubTypes.Type(value = ContentBlock.ToolUseBlock.class, name = "tool_use"),
    @JsonSubTypes.Type(value = ContentBlock.ToolResultBlock.class, name = "tool_result")
})
public abstract class ContentBlock {

    public abstract String asPlainText();

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class TextBlock extends ContentBlock {
        String text;

        @Override
        public String asPlainText() {
            return text == null ? "" : text;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ToolUseBlock extends ContentBlock {
        String id;
        String name;
        JsonNode input;

        @Override
        public String asPlainText() {
            return "";
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ToolResultBlock extends ContentBlock {
        String toolUseId;
        String content;

        @Override
        public String asPlainText() {
            return content == null ? "" : content;
        }
    }
}
