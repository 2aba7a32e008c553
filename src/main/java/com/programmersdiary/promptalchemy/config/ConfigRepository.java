package com.programmersdiary.promptalchemy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Repository
public class ConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(ConfigRepository.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path configFile;
    private volatile LocalConfig config = LocalConfig.defaults();

    public ConfigRepository(AppPaths paths) {
        this.configFile = paths.configFile();
    }

    @PostConstruct
    public void load() {
        config = read(configFile).orElseGet(LocalConfig::defaults);
    }

    public LocalConfig current() {
        return config;
    }

    public synchronized void save() {
        try {
            Files.createDirectories(configFile.getParent());
            objectMapper.writeValue(configFile.toFile(), config);
            log.debug("Configuration saved to {}", configFile);
        } catch (IOException e) {
            log.error("Failed to save configuration to {}", configFile, e);
            throw new UncheckedIOException(e);
        }
    }

    public Optional<LocalConfig> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), LocalConfig.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable config {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
