package com.programmersdiary.promptalchemy.journal;

import java.util.LinkedHashMap;
import java.util.Map;

public record LogQuery(String text, Map<String, String> equalTo, String from, String to) {

    public LogQuery {
        equalTo = equalTo == null ? Map.of() : Map.copyOf(equalTo);
    }

    public static LogQuery all() {
        return new LogQuery(null, Map.of(), null, null);
    }

    public LogQuery withText(String text) {
        return new LogQuery(text, equalTo, from, to);
    }

    public LogQuery where(String field, String value) {
        if (value == null || value.isBlank()) return this;
        var filters = new LinkedHashMap<>(equalTo);
        filters.put(field, value);
        return new LogQuery(text, filters, from, to);
    }

    public LogQuery between(String from, String to) {
        return new LogQuery(text, equalTo, from, to);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasFrom() {
        return from != null && !from.isBlank();
    }

    public boolean hasTo() {
        return to != null && !to.isBlank();
    }

    public boolean isEmpty() {
        return !hasText() && equalTo.isEmpty() && !hasFrom() && !hasTo();
    }
}
