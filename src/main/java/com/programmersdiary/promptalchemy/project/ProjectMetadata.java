package com.programmersdiary.promptalchemy.project;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectMetadata(String name, String created, String description, List<String> tags) {

    public ProjectMetadata {
        description = description != null ? description : "";
        tags = tags != null ? List.copyOf(cleaned(tags)) : List.of();
    }

    public static ProjectMetadata create(String name, String created) {
        return new ProjectMetadata(name, created, "", List.of());
    }

    public ProjectMetadata withDescription(String description) {
        return new ProjectMetadata(name, created, description, tags);
    }

    public ProjectMetadata withTags(Collection<String> added) {
        var merged = new TreeSet<>(tags);
        merged.addAll(cleaned(added));
        return new ProjectMetadata(name, created, description, List.copyOf(merged));
    }

    public ProjectMetadata withoutTags(Collection<String> removed) {
        var remaining = new TreeSet<>(tags);
        remaining.removeAll(cleaned(removed));
        return new ProjectMetadata(name, created, description, List.copyOf(remaining));
    }

    private static TreeSet<String> cleaned(Collection<String> tags) {
        var result = new TreeSet<String>();
        for (var tag : tags) {
            if (tag == null || tag.isBlank()) continue;
            result.add(tag.trim());
        }
        return result;
    }
}
