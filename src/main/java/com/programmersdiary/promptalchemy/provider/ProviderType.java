package com.programmersdiary.promptalchemy.provider;

import com.programmersdiary.promptalchemy.config.LocalConfig;

import java.util.Arrays;
import java.util.List;

public enum ProviderType {
    OPENAI(List.of("openai"), "gpt-4o-mini", true),
    ANTHROPIC(List.of("anthropic"), "claude-sonnet-4-20250514", true),
    GEMINI(List.of("gemini", "google"), "gemini-2.0-flash", true),
    OLLAMA(List.of("ollama"), "llama3.2", false);

    private final List<String> ids;
    private final String defaultModel;
    private final boolean requiresApiKey;

    ProviderType(List<String> ids, String defaultModel, boolean requiresApiKey) {
        this.ids = ids;
        this.defaultModel = defaultModel;
        this.requiresApiKey = requiresApiKey;
    }

    public String id() {
        return ids.get(0);
    }

    public String defaultModel() {
        return defaultModel;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    public static ProviderType fromId(String providerId) {
        var id = LocalConfig.normalizeProvider(providerId);
        return Arrays.stream(values())
                .filter(type -> type.ids.contains(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported provider: " + providerId));
    }
}
