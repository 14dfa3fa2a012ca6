package com.autonomous.gateway.model;

import java.util.Arrays;
import java.util.Optional;

public enum ProviderType {
    CLAUDE("claude", "Anthropic Claude"),
    OPENAI("openai", "OpenAI"),
    HUGGINGFACE("huggingface", "HuggingFace"),
    GEMINI("gemini", "Google Gemini"),
    CUSTOM("custom", "Custom Provider");

    private final String id;
    private final String displayName;

    ProviderType(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts either the lowercase id ("claude") or the enum name ("CLAUDE").
     */
    public static Optional<ProviderType> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.id.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
            .findFirst();
    }
}
