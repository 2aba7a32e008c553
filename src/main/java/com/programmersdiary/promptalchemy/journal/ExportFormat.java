package com.programmersdiary.promptalchemy.journal;

import java.util.Locale;

public enum ExportFormat {
    ARRAY,
    LINES;

    public static ExportFormat fromName(String name) {
        if (name == null || name.isBlank()) return ARRAY;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "array", "json" -> ARRAY;
            case "lines", "jsonl" -> LINES;
            default -> throw new IllegalArgumentException("Unknown export format: " + name);
        };
    }
}
