package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Message {
    MessageRole role;
    MessageContent content;
    @Builder.Default
    long timestamp = System.currentTimeMillis();
    MessageMetadata metadata;

    public static Message of(MessageRole role, String text) {
        return Message.builder()
            .role(role)
            .content(MessageContent.text(text))
            .build();
    }

    public String getText() {
        return content == null ? "" : content.asPlainText();
    }
}
