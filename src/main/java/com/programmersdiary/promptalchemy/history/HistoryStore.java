package com.programmersdiary.promptalchemy.history;

import com.programmersdiary.promptalchemy.config.AppPaths;
import com.programmersdiary.promptalchemy.config.LocalConfig;
import com.programmersdiary.promptalchemy.journal.AppendLog;
import com.programmersdiary.promptalchemy.journal.ExportFormat;
import com.programmersdiary.promptalchemy.journal.LogQuery;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.programmersdiary.promptalchemy.history.EnhancementRecord.MODEL;
import static com.programmersdiary.promptalchemy.history.EnhancementRecord.PROVIDER;

@Repository
public class HistoryStore {

    private final AppendLog journal;

    public HistoryStore(AppPaths paths, Clock clock) {
        this.journal = new AppendLog(paths.historyFile(), EnhancementRecord.TEXT_FIELDS, clock);
    }

    public boolean add(Map<String, ?> entry) {
        return journal.append(entry);
    }

    public boolean add(EnhancementRecord entry) {
        return journal.append(entry.toMap());
    }

    public List<Map<String, Object>> entries(int limit) {
        return journal.readAll(limit);
    }

    public List<Map<String, Object>> search(String query, String provider, String model, String from, String to) {
        return journal.search(LogQuery.all()
                .withText(query)
                .where(PROVIDER, provider == null || provider.isBlank() ? null : LocalConfig.normalizeProvider(provider))
                .where(MODEL, model)
                .between(from, to));
    }

    public Optional<Map<String, Object>> entry(int index) {
        var entries = journal.readAll();
        if (index < 0 || index >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(index));
    }

    public boolean clear() {
        return journal.clear();
    }

    public void export(Path target, ExportFormat format) {
        journal.export(target, format);
    }
}
