package com.programmersdiary.promptalchemy.web;

import com.programmersdiary.promptalchemy.config.AppPaths;
import com.programmersdiary.promptalchemy.journal.LogQuery;
import com.programmersdiary.promptalchemy.project.Project;
import com.programmersdiary.promptalchemy.project.ProjectMetadata;
import com.programmersdiary.promptalchemy.project.ProjectStore;
import com.programmersdiary.promptalchemy.project.ProjectSummary;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectStore projectStore;
    private final AppPaths paths;

    public ProjectController(ProjectStore projectStore, AppPaths paths) {
        this.projectStore = projectStore;
        this.paths = paths;
    }

    @GetMapping
    public List<ProjectSummary> list() {
        return projectStore.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectMetadata create(@RequestBody Map<String, String> request) {
        return projectStore.create(request.get("name"), request.get("description")).metadata();
    }

    @GetMapping("/{name}")
    public ProjectMetadata get(@PathVariable String name) {
        return find(name).metadata();
    }

    @DeleteMapping("/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String name) {
        if (!projectStore.delete(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }

    @GetMapping("/{name}/prompts")
    public List<Map<String, Object>> prompts(@PathVariable String name,
                                             @RequestParam(required = false) String query,
                                             @RequestParam(required = false) Integer limit) {
        var prompts = find(name).search(LogQuery.all().withText(query));
        if (limit != null && limit > 0 && prompts.size() > limit) {
            return prompts.subList(0, limit);
        }
        return prompts;
    }

    @PutMapping("/{name}/description")
    public ProjectMetadata describe(@PathVariable String name, @RequestBody Map<String, String> request) {
        var project = find(name);
        project.setDescription(request.getOrDefault("description", ""));
        return project.metadata();
    }

    @PostMapping("/{name}/tags")
    public ProjectMetadata addTags(@PathVariable String name, @RequestBody List<String> tags) {
        var project = find(name);
        project.addTags(tags);
        return project.metadata();
    }

    @DeleteMapping("/{name}/tags")
    public ProjectMetadata removeTags(@PathVariable String name, @RequestBody List<String> tags) {
        var project = find(name);
        project.removeTags(tags);
        return project.metadata();
    }

    @PostMapping("/{name}/export")
    public Map<String, String> export(@PathVariable String name, @RequestBody ExportRequest request) {
        var project = find(name);
        var target = paths.exportTarget(request.path());
        project.export(target);
        return Map.of("path", target.toString());
    }

    private Project find(String name) {
        return projectStore.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Project not found: " + name));
    }
}
