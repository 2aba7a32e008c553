package com.programmersdiary.promptalchemy.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.programmersdiary.promptalchemy.history.EnhancementRecord;
import com.programmersdiary.promptalchemy.journal.AppendLog;
import com.programmersdiary.promptalchemy.journal.LogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Project {

    private static final Logger log = LoggerFactory.getLogger(Project.class);

    public static final String PROJECT_FIELD = "project";
    static final String METADATA_FILE = "project.json";
    static final String PROMPTS_FILE = "prompts.jsonl";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final String slug;
    private final Path directory;
    private final AppendLog prompts;
    private ProjectMetadata metadata;

    Project(String slug, Path directory, ProjectMetadata metadata, Clock clock) {
        this.slug = slug;
        this.directory = directory;
        this.metadata = metadata;
        this.prompts = new AppendLog(directory.resolve(PROMPTS_FILE), EnhancementRecord.TEXT_FIELDS, clock);
    }

    public synchronized String name() {
        return metadata.name();
    }

    public String slug() {
        return slug;
    }

    public Path directory() {
        return directory;
    }

    public synchronized ProjectMetadata metadata() {
        return metadata;
    }

    public synchronized void setDescription(String description) {
        update(metadata.withDescription(description));
    }

    public synchronized void addTags(Collection<String> tags) {
        update(metadata.withTags(tags));
    }

    public synchronized void removeTags(Collection<String> tags) {
        update(metadata.withoutTags(tags));
    }

    public boolean addPrompt(Map<String, ?> record) {
        var entry = new LinkedHashMap<String, Object>(record);
        entry.put(PROJECT_FIELD, name());
        var written = prompts.append(entry);
        if (written) {
            log.info("Added prompt to project: {}", name());
        }
        return written;
    }

    public List<Map<String, Object>> prompts() {
        return prompts.readAll();
    }

    public List<Map<String, Object>> prompts(int limit) {
        return prompts.readAll(limit);
    }

    public List<Map<String, Object>> search(LogQuery query) {
        return prompts.search(query);
    }

    public int promptCount() {
        return prompts.count();
    }

    public void export(Path target) {
        var document = new LinkedHashMap<String, Object>();
        document.put("metadata", metadata());
        document.put("prompts", prompts());
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            objectMapper.writeValue(target.toFile(), document);
            log.info("Exported project {} to {}", name(), target);
        } catch (IOException e) {
            log.error("Failed to export project {}: {}", name(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    synchronized void save() {
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(directory.resolve(METADATA_FILE).toFile(), metadata);
        } catch (IOException e) {
            log.error("Failed to save metadata for project {}: {}", metadata.name(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    private void update(ProjectMetadata updated) {
        metadata = updated;
        save();
    }
}
