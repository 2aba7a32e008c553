package com.programmersdiary.promptalchemy.enhance;

import com.programmersdiary.promptalchemy.provider.ModelSettings;

public interface PromptEnhancer {

    EnhancedPrompt enhance(ModelSettings settings, String prompt);
}
