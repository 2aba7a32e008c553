package com.programmersdiary.promptalchemy.project;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProjectSummary(String name,
                             String slug,
                             String created,
                             String description,
                             List<String> tags,
                             @JsonProperty("prompt_count") int promptCount) {

    static ProjectSummary of(String slug, ProjectMetadata metadata, int promptCount) {
        return new ProjectSummary(metadata.name(), slug, metadata.created(), metadata.description(),
                metadata.tags(), promptCount);
    }
}
