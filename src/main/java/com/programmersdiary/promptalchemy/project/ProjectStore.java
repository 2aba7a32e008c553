package com.programmersdiary.promptalchemy.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.programmersdiary.promptalchemy.config.AppPaths;
import com.programmersdiary.promptalchemy.journal.Timestamps;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path projectsDir;
    private final Clock clock;
    private final Map<String, Project> open = new ConcurrentHashMap<>();

    public ProjectStore(AppPaths paths, Clock clock) {
        this.projectsDir = paths.projectsDir();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(projectsDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Letters, digits, {@code -} and {@code _} survive, everything else becomes {@code _};
     * the result is lower-cased so uniqueness does not depend on the file system's case rules.
     */
    public static String slug(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        var trimmed = name.trim();
        var slug = new StringBuilder(trimmed.length());
        trimmed.codePoints().forEach(c -> {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                slug.appendCodePoint(c);
            } else {
                slug.append('_');
            }
        });
        return slug.toString().toLowerCase(Locale.ROOT);
    }

    public synchronized Project create(String name) {
        var slug = slug(name);
        var dir = projectsDir.resolve(slug);
        if (Files.exists(dir)) {
            throw new ProjectExistsException(name.trim(), slug);
        }
        var project = new Project(slug, dir, ProjectMetadata.create(name.trim(), Timestamps.now(clock)), clock);
        project.save();
        open.put(slug, project);
        log.info("Created project: {}", project.name());
        return project;
    }

    public synchronized Project create(String name, String description) {
        var project = create(name);
        if (description != null && !description.isBlank()) {
            project.setDescription(description.trim());
        }
        return project;
    }

    public Optional<Project> find(String name) {
        var slug = slug(name);
        var dir = projectsDir.resolve(slug);
        if (!Files.isDirectory(dir)) {
            open.remove(slug);
            return Optional.empty();
        }
        return Optional.of(open.computeIfAbsent(slug, s -> load(s, dir, name.trim())));
    }

    public synchronized Project getOrCreate(String name) {
        return find(name).orElseGet(() -> create(name));
    }

    public List<ProjectSummary> list() {
        var summaries = new ArrayList<ProjectSummary>();
        try (var stream = Files.list(projectsDir)) {
            stream.filter(Files::isDirectory)
                    .filter(dir -> Files.isRegularFile(dir.resolve(Project.METADATA_FILE)))
                    .forEach(dir -> {
                        var slug = dir.getFileName().toString();
                        readMetadata(dir, slug).ifPresent(metadata -> {
                            var project = open.computeIfAbsent(slug, s -> new Project(s, dir, metadata, clock));
                            summaries.add(ProjectSummary.of(slug, project.metadata(), project.promptCount()));
                        });
                    });
        } catch (IOException e) {
            log.error("Failed to list projects in {}: {}", projectsDir, e.getMessage());
            return List.of();
        }
        summaries.sort(Comparator.comparing(ProjectSummary::created, Timestamps::compare).reversed());
        return summaries;
    }

    public synchronized boolean delete(String name) {
        var project = find(name);
        if (project.isEmpty()) {
            return false;
        }
        var dir = project.get().directory();
        try (var stream = Files.walk(dir)) {
            for (var path : stream.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
            open.remove(project.get().slug());
            log.info("Deleted project: {}", project.get().name());
            return true;
        } catch (IOException e) {
            log.error("Failed to delete project {}: {}", name, e.getMessage());
            return false;
        }
    }

    private Project load(String slug, Path dir, String requestedName) {
        var metadata = readMetadata(dir, requestedName)
                .orElseGet(() -> ProjectMetadata.create(requestedName, Timestamps.now(clock)));
        return new Project(slug, dir, metadata, clock);
    }

    private Optional<ProjectMetadata> readMetadata(Path dir, String fallbackName) {
        var file = dir.resolve(Project.METADATA_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            var metadata = objectMapper.readValue(file.toFile(), ProjectMetadata.class);
            if (metadata != null && metadata.name() == null) {
                metadata = new ProjectMetadata(fallbackName, metadata.created(), metadata.description(), metadata.tags());
            }
            return Optional.ofNullable(metadata);
        } catch (IOException e) {
            log.warn("Ignoring unreadable project metadata {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
