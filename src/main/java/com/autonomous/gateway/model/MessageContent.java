package com.autonomous.gateway.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Body of a conversation message: plain text, text with images, or structured blocks.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MessageContent.Text.class, name = "text"),
    @JsonSubTypes.Type(value = MessageContent.MultiModal.class, name = "multimodal"),
    @JsonSubTypes.Type(value = MessageContent.Structured.class, name = "structured")
})
public abstract class MessageContent {

    /**
     * The textual part of this content. Images are dropped, structured blocks contribute
     * their text and tool-result bodies.
     */
    public abstract String asPlainText();

    public static Text text(String text) {
        return new Text(text);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Text extends MessageContent {
        String text;

        @Override
        public String asPlainText() {
            return text == null ? "" : text;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class MultiModal extends MessageContent {
        String text;
        List<ImageContent> images;

        @Override
        public String asPlainText() {
            return text == null ? "" : text;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Structured extends MessageContent {
        List<ContentBlock> blocks;

        @Override
        public String asPlainText() {
            return blocks.stream()
                .map(ContentBlock::asPlainText)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
        }
    }
}
