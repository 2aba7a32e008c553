package com.programmersdiary.promptalchemy.cli;

import com.programmersdiary.promptalchemy.enhance.EnhancementRequest;
import com.programmersdiary.promptalchemy.enhance.EnhancementService;
import com.programmersdiary.promptalchemy.history.EnhancementRecord;
import com.programmersdiary.promptalchemy.history.HistoryStore;
import com.programmersdiary.promptalchemy.journal.AppendLog;
import com.programmersdiary.promptalchemy.provider.ProviderType;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Scanner;

@Component
@Profile("cli")
public class InteractiveCli implements CommandLineRunner {

    private final EnhancementService enhancementService;
    private final HistoryStore historyStore;

    public InteractiveCli(EnhancementService enhancementService, HistoryStore historyStore) {
        this.enhancementService = enhancementService;
        this.historyStore = historyStore;
    }

    @Override
    public void run(String... args) {
        var scanner = new Scanner(System.in);

        System.out.println("\n=== PromptAlchemy ===\n");

        var provider = selectProvider(scanner);
        if (provider == null) return;

        String project = null;
        System.out.println("Type a prompt to enhance. Commands: /project <name>, /history, /provider, /quit\n");

        while (true) {
            System.out.print(project != null ? "[" + project + "] > " : "> ");
            if (!scanner.hasNextLine()) break;
            var input = scanner.nextLine().trim();

            if (input.isEmpty()) continue;
            if (input.equalsIgnoreCase("/quit")) break;
            if (input.equalsIgnoreCase("/provider")) {
                var selected = selectProvider(scanner);
                if (selected != null) provider = selected;
                continue;
            }
            if (input.toLowerCase(Locale.ROOT).startsWith("/project")) {
                var name = input.substring("/project".length()).trim();
                project = name.isEmpty() ? null : name;
                System.out.println(project == null ? "Not saving to a project.\n" : "Saving to project: " + project + "\n");
                continue;
            }
            if (input.equalsIgnoreCase("/history")) {
                printHistory();
                continue;
            }

            try {
                var result = enhancementService.enhance(new EnhancementRequest(input, provider.id(), null, project));
                System.out.println("\n" + result.enhancedPrompt() + "\n");
                if (result.tokensUsed() != null) {
                    System.out.println("(" + result.model() + ", " + result.tokensUsed() + " tokens)\n");
                }
            } catch (Exception e) {
                System.out.println("\nError: " + e.getMessage() + "\n");
            }
        }

        System.out.println("Goodbye!");
    }

    private void printHistory() {
        var entries = historyStore.entries(5);
        if (entries.isEmpty()) {
            System.out.println("No history entries found.\n");
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            var original = String.valueOf(entry.get(EnhancementRecord.ORIGINAL_PROMPT));
            System.out.printf("  [%d] %s %s/%s: %s%n", i,
                    entry.get(AppendLog.TIMESTAMP),
                    entry.get(EnhancementRecord.PROVIDER),
                    entry.get(EnhancementRecord.MODEL),
                    original.length() > 60 ? original.substring(0, 60) + "..." : original);
        }
        System.out.println();
    }

    private ProviderType selectProvider(Scanner scanner) {
        var providers = ProviderType.values();
        System.out.println("Available providers:");
        for (int i = 0; i < providers.length; i++) {
            var p = providers[i];
            System.out.printf("  %d) %s (%s)%n", i + 1, p.id(), p.defaultModel());
        }

        System.out.print("Select provider (number): ");
        if (!scanner.hasNextLine()) return null;
        var choice = scanner.nextLine().trim();

        int index;
        try {
            index = Integer.parseInt(choice) - 1;
        } catch (NumberFormatException e) {
            index = -1;
        }
        if (index < 0 || index >= providers.length) {
            System.out.println("Invalid selection.");
            return null;
        }
        var selected = providers[index];
        System.out.println("Using: " + selected.id() + "\n");
        return selected;
    }
}
