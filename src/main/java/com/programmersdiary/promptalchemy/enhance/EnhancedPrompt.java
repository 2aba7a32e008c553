package com.programmersdiary.promptalchemy.enhance;

public record EnhancedPrompt(String text, Integer tokensUsed) {
}
