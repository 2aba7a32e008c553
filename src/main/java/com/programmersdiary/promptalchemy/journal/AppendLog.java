package com.programmersdiary.promptalchemy.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public class AppendLog {

    private static final Logger log = LoggerFactory.getLogger(AppendLog.class);

    public static final String TIMESTAMP = "timestamp";

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ObjectMapper exportMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path file;
    private final List<String> textFields;
    private final Clock clock;

    public AppendLog(Path file, List<String> textFields, Clock clock) {
        this.file = file;
        this.textFields = List.copyOf(textFields);
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public synchronized boolean append(Map<String, ?> record) {
        var entry = new LinkedHashMap<String, Object>(record);
        var timestamp = entry.get(TIMESTAMP);
        if (timestamp == null || timestamp.toString().isBlank()) {
            entry.put(TIMESTAMP, Timestamps.now(clock));
        }
        try {
            var line = objectMapper.writeValueAsString(entry) + "\n";
            Files.createDirectories(file.getParent());
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Appended record to {}", file.getFileName());
            return true;
        } catch (IOException e) {
            log.error("Failed to append record to {}: {}", file, e.getMessage());
            return false;
        }
    }

    public List<Map<String, Object>> readAll() {
        return readAll(0);
    }

    public List<Map<String, Object>> readAll(int limit) {
        var records = newestFirst(parse());
        if (limit > 0 && records.size() > limit) {
            return List.copyOf(records.subList(0, limit));
        }
        return records;
    }

    public List<Map<String, Object>> search(LogQuery query) {
        if (query == null || query.isEmpty()) {
            return readAll();
        }
        return readAll().stream()
                .filter(record -> matches(record, query))
                .toList();
    }

    public int count() {
        return parse().size();
    }

    public synchronized boolean clear() {
        try {
            Files.deleteIfExists(file);
            log.info("Cleared {}", file.getFileName());
            return true;
        } catch (IOException e) {
            log.error("Failed to clear {}: {}", file, e.getMessage());
            return false;
        }
    }

    public synchronized void export(Path target, ExportFormat format) {
        var records = readAll();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            if (format == ExportFormat.ARRAY) {
                exportMapper.writeValue(target.toFile(), records);
            } else {
                var out = new StringBuilder();
                for (var record : records) {
                    out.append(objectMapper.writeValueAsString(record)).append('\n');
                }
                Files.writeString(target, out.toString(), StandardCharsets.UTF_8);
            }
            log.info("Exported {} entries to {}", records.size(), target);
        } catch (IOException e) {
            log.error("Failed to export {} to {}: {}", file.getFileName(), target, e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    private List<Map<String, Object>> parse() {
        if (!Files.exists(file)) {
            return List.of();
        }
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            return List.of();
        }
        var records = new ArrayList<Map<String, Object>>();
        var lines = content.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            var trimmed = lines.get(i).strip();
            if (trimmed.isEmpty()) continue;
            try {
                var record = objectMapper.readValue(trimmed, RECORD_TYPE);
                if (record != null) {
                    records.add(record);
                }
            } catch (JsonProcessingException e) {
                log.warn("Invalid JSON in {} line {}: {}", file.getFileName(), i + 1,
                        trimmed.substring(0, Math.min(50, trimmed.length())));
            }
        }
        return records;
    }

    private static List<Map<String, Object>> newestFirst(List<Map<String, Object>> records) {
        record Keyed(Map<String, Object> record, String raw, Instant parsed) {}
        return records.stream()
                .map(r -> {
                    var raw = Objects.toString(r.get(TIMESTAMP), "");
                    return new Keyed(r, raw, Timestamps.parse(raw).orElse(null));
                })
                .sorted((x, y) -> Timestamps.compare(y.raw(), y.parsed(), x.raw(), x.parsed()))
                .map(Keyed::record)
                .toList();
    }

    private boolean matches(Map<String, Object> record, LogQuery query) {
        for (var filter : query.equalTo().entrySet()) {
            var value = record.get(filter.getKey());
            if (value == null || !filter.getValue().equals(value.toString())) {
                return false;
            }
        }
        if (query.hasFrom() || query.hasTo()) {
            var timestamp = Objects.toString(record.get(TIMESTAMP), "");
            if (query.hasFrom() && Timestamps.compare(timestamp, query.from()) < 0) return false;
            if (query.hasTo() && Timestamps.compare(timestamp, query.to()) > 0) return false;
        }
        if (query.hasText()) {
            var needle = query.text().toLowerCase(Locale.ROOT);
            return textFields.stream()
                    .map(record::get)
                    .filter(Objects::nonNull)
                    .anyMatch(value -> value.toString().toLowerCase(Locale.ROOT).contains(needle));
        }
        return true;
    }
}
