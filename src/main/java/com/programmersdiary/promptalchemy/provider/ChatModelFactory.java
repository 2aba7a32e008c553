package com.programmersdiary.promptalchemy.provider;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;

@Component
public class ChatModelFactory {

    static final String GEMINI_OPENAI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai";
    static final String OLLAMA_BASE_URL = "http://localhost:11434";

    public ChatModel create(ModelSettings settings) {
        return switch (settings.type()) {
            case OPENAI -> createOpenAi(settings);
            case ANTHROPIC -> createAnthropic(settings);
            case GEMINI -> createGemini(settings);
            case OLLAMA -> createOllama(settings);
        };
    }

    private ChatModel createOpenAi(ModelSettings settings) {
        var apiBuilder = OpenAiApi.builder()
                .apiKey(settings.apiKey() != null ? settings.apiKey() : "unused");
        if (settings.baseUrl() != null) {
            apiBuilder.baseUrl(settings.baseUrl());
        }
        var options = OpenAiChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(apiBuilder.build())
                .defaultOptions(options)
                .build();
    }

    private ChatModel createAnthropic(ModelSettings settings) {
        var api = AnthropicApi.builder()
                .apiKey(settings.apiKey())
                .build();
        var options = AnthropicChatOptions.builder()
                .model(settings.model())
                .maxTokens(settings.maxTokens())
                .temperature(settings.temperature())
                .build();
        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(options)
                .build();
    }

    private ChatModel createGemini(ModelSettings settings) {
        var api = OpenAiApi.builder()
                .apiKey(settings.apiKey())
                .baseUrl(settings.baseUrl() != null ? settings.baseUrl() : GEMINI_OPENAI_BASE_URL)
                .build();
        var options = OpenAiChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .build();
    }

    private ChatModel createOllama(ModelSettings settings) {
        var api = OllamaApi.builder()
                .baseUrl(settings.baseUrl() != null ? settings.baseUrl() : OLLAMA_BASE_URL)
                .build();
        var options = OllamaChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .build();
        return OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(options)
                .build();
    }
}
