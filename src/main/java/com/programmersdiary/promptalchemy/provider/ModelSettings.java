package com.programmersdiary.promptalchemy.provider;

public record ModelSettings(ProviderType type,
                            String model,
                            String apiKey,
                            String baseUrl,
                            Double temperature,
                            Integer maxTokens) {

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 4096;

    public ModelSettings {
        model = model != null && !model.isBlank() ? model : type.defaultModel();
        temperature = temperature != null ? temperature : DEFAULT_TEMPERATURE;
        maxTokens = maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
    }
}
