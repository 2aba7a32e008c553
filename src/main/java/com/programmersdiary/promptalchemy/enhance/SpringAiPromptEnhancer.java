package com.programmersdiary.promptalchemy.enhance;

import com.programmersdiary.promptalchemy.provider.ChatModelFactory;
import com.programmersdiary.promptalchemy.provider.ModelSettings;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SpringAiPromptEnhancer implements PromptEnhancer {

    static final String SYSTEM_INSTRUCTIONS = "You are an expert at enhancing prompts for LLMs. "
            + "Transform the given prompt into a comprehensive, well-structured prompt "
            + "that will produce the best possible results.";

    private final ChatModelFactory chatModelFactory;

    public SpringAiPromptEnhancer(ChatModelFactory chatModelFactory) {
        this.chatModelFactory = chatModelFactory;
    }

    @Override
    public EnhancedPrompt enhance(ModelSettings settings, String prompt) {
        var chatModel = chatModelFactory.create(settings);
        var response = chatModel.call(new Prompt(List.of(
                new SystemMessage(SYSTEM_INSTRUCTIONS),
                new UserMessage(prompt))));
        var text = response.getResult() != null ? response.getResult().getOutput().getText() : null;
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Empty response from " + settings.type().id());
        }
        Integer tokens = null;
        if (response.getMetadata() != null && response.getMetadata().getUsage() != null) {
            tokens = response.getMetadata().getUsage().getTotalTokens();
        }
        return new EnhancedPrompt(text.trim(), tokens);
    }
}
