package com.programmersdiary.promptalchemy.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class SiblingConfigLocator {

    private static final Logger log = LoggerFactory.getLogger(SiblingConfigLocator.class);

    private static final Path WINDOWS_USERS = Path.of("/mnt/c/Users");

    private final AppPaths paths;
    private final ConfigRepository configRepository;
    private final String siblingApp;

    public SiblingConfigLocator(AppPaths paths,
                                ConfigRepository configRepository,
                                @Value("${promptalchemy.import.sibling-app:ImageAI}") String siblingApp) {
        this.paths = paths;
        this.configRepository = configRepository;
        this.siblingApp = siblingApp;
    }

    public List<Path> candidates() {
        var candidates = new ArrayList<Path>();
        var parent = paths.configDir().getParent();
        if (parent != null) {
            candidates.add(parent.resolve(siblingApp).resolve("config.json"));
        }
        if (isWsl() && Files.isDirectory(WINDOWS_USERS)) {
            try (var users = Files.list(WINDOWS_USERS)) {
                users.filter(Files::isDirectory)
                        .map(user -> user.resolve("AppData").resolve("Roaming").resolve(siblingApp).resolve("config.json"))
                        .forEach(candidates::add);
            } catch (IOException e) {
                log.debug("Error checking Windows AppData: {}", e.getMessage());
            }
        }
        return candidates;
    }

    public Optional<LocalConfig> locate() {
        for (var candidate : candidates()) {
            var config = configRepository.read(candidate);
            if (config.isEmpty()) continue;
            if (config.get().hasImportableData()) {
                log.info("Found {} config with data at: {}", siblingApp, candidate);
                return config;
            }
            log.debug("Config at {} is empty, skipping", candidate);
        }
        log.debug("No {} config with data found for import", siblingApp);
        return Optional.empty();
    }

    private static boolean isWsl() {
        if (!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("linux")) {
            return false;
        }
        try {
            return Files.readString(Path.of("/proc/version"), StandardCharsets.UTF_8)
                    .toLowerCase(Locale.ROOT).contains("microsoft");
        } catch (IOException e) {
            return false;
        }
    }
}
