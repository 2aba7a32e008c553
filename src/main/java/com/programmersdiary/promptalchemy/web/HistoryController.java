package com.programmersdiary.promptalchemy.web;

import com.programmersdiary.promptalchemy.config.AppPaths;
import com.programmersdiary.promptalchemy.history.HistoryStore;
import com.programmersdiary.promptalchemy.journal.ExportFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/history")
public class HistoryController {

    private final HistoryStore historyStore;
    private final AppPaths paths;

    public HistoryController(HistoryStore historyStore, AppPaths paths) {
        this.historyStore = historyStore;
        this.paths = paths;
    }

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(required = false) Integer limit,
                                          @RequestParam(required = false) String query,
                                          @RequestParam(required = false) String provider,
                                          @RequestParam(required = false) String model,
                                          @RequestParam(required = false) String from,
                                          @RequestParam(required = false) String to) {
        var entries = historyStore.search(query, provider, model, from, to);
        if (limit != null && limit > 0 && entries.size() > limit) {
            return entries.subList(0, limit);
        }
        return entries;
    }

    @GetMapping("/{index}")
    public Map<String, Object> get(@PathVariable int index) {
        return historyStore.entry(index)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No history entry at index " + index));
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear() {
        if (!historyStore.clear()) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to clear history");
        }
    }

    @PostMapping("/export")
    public Map<String, String> export(@RequestBody ExportRequest request) {
        var target = paths.exportTarget(request.path());
        var format = ExportFormat.fromName(request.format());
        historyStore.export(target, format);
        return Map.of("path", target.toString(), "format", format.name().toLowerCase(Locale.ROOT));
    }
}
