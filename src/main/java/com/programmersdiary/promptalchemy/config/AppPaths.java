package com.programmersdiary.promptalchemy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

@Component
public class AppPaths {

    public static final String APP_NAME = "PromptAlchemy";

    private final Path configDir;
    private final Path exportsDir;

    public AppPaths(@Value("${promptalchemy.config-dir:}") String configDir,
                    @Value("${promptalchemy.export-dir:}") String exportsDir) {
        this.configDir = configDir == null || configDir.isBlank()
                ? defaultConfigDir()
                : Path.of(configDir);
        this.exportsDir = exportsDir == null || exportsDir.isBlank()
                ? this.configDir.resolve("exports")
                : Path.of(exportsDir);
    }

    public static AppPaths of(Path configDir) {
        return new AppPaths(configDir.toString(), "");
    }

    public Path configDir() {
        return configDir;
    }

    public Path configFile() {
        return configDir.resolve("config.json");
    }

    public Path historyFile() {
        return configDir.resolve("history.jsonl");
    }

    public Path projectsDir() {
        return configDir.resolve("projects");
    }

    public Path exportsDir() {
        return exportsDir;
    }

    /**
     * Resolves a client-supplied export name inside {@link #exportsDir()}. Absolute paths
     * and names that climb out of the directory are rejected.
     */
    public Path exportTarget(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Export path is required");
        }
        var relative = Path.of(name.trim());
        if (relative.isAbsolute() || relative.getRoot() != null) {
            throw new IllegalArgumentException("Export path must be relative to the export directory: " + name);
        }
        var base = exportsDir.toAbsolutePath().normalize();
        var target = base.resolve(relative).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new IllegalArgumentException("Export path escapes the export directory: " + name);
        }
        return target;
    }

    static Path defaultConfigDir() {
        var home = Path.of(System.getProperty("user.home"));
        var os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            var appData = System.getenv("APPDATA");
            var base = appData != null ? Path.of(appData) : home.resolve("AppData").resolve("Roaming");
            return base.resolve(APP_NAME);
        }
        if (os.contains("mac")) {
            return home.resolve("Library").resolve("Application Support").resolve(APP_NAME);
        }
        var xdg = System.getenv("XDG_CONFIG_HOME");
        var base = xdg != null && !xdg.isBlank() ? Path.of(xdg) : home.resolve(".config");
        return base.resolve(APP_NAME);
    }
}
