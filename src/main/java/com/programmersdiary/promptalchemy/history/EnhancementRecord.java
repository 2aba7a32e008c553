package com.programmersdiary.promptalchemy.history;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record EnhancementRecord(String originalPrompt,
                                String enhancedPrompt,
                                String provider,
                                String model,
                                Integer tokensUsed) {

    public static final String ORIGINAL_PROMPT = "original_prompt";
    public static final String ENHANCED_PROMPT = "enhanced_prompt";
    public static final String PROVIDER = "provider";
    public static final String MODEL = "model";
    public static final String TOKENS_USED = "tokens_used";

    public static final List<String> TEXT_FIELDS = List.of(ORIGINAL_PROMPT, ENHANCED_PROMPT);

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(ORIGINAL_PROMPT, originalPrompt);
        map.put(ENHANCED_PROMPT, enhancedPrompt);
        map.put(PROVIDER, provider);
        map.put(MODEL, model);
        if (tokensUsed != null) {
            map.put(TOKENS_USED, tokensUsed);
        }
        return map;
    }
}
