package com.programmersdiary.promptalchemy.enhance;

public record EnhancementResult(String originalPrompt,
                                String enhancedPrompt,
                                String provider,
                                String model,
                                Integer tokensUsed,
                                String timestamp,
                                String project) {
}
