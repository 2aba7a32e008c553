package com.programmersdiary.promptalchemy.enhance;

public record EnhancementRequest(String prompt, String provider, String model, String project) {
}
