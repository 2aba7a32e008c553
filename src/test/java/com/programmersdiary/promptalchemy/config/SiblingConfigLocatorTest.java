package com.programmersdiary.promptalchemy.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SiblingConfigLocatorTest {

    @TempDir
    Path tempDir;

    private SiblingConfigLocator locator() {
        var paths = AppPaths.of(tempDir.resolve("PromptAlchemy"));
        return new SiblingConfigLocator(paths, new ConfigRepository(paths), "ImageAI");
    }

    @Test
    void firstCandidateIsNextToOwnConfigDir() {
        assertThat(locator().candidates()).first()
                .isEqualTo(tempDir.resolve("ImageAI").resolve("config.json"));
    }

    @Test
    void findsSiblingConfigWithData() throws Exception {
        var sibling = tempDir.resolve("ImageAI");
        Files.createDirectories(sibling);
        Files.writeString(sibling.resolve("config.json"), """
                {"providers": {"google": {"api_key": "g-key"}}, "auth_mode": "api_key", "theme": "dark"}
                """);

        var located = locator().locate();

        assertThat(located).hasValueSatisfying(config -> {
            assertThat(config.provider("google")).hasValueSatisfying(p -> assertThat(p.getApiKey()).isEqualTo("g-key"));
            assertThat(config.getAuthMode()).isEqualTo("api_key");
        });
    }

    @Test
    void skipsConfigWithoutImportableData() throws Exception {
        var sibling = tempDir.resolve("ImageAI");
        Files.createDirectories(sibling);
        Files.writeString(sibling.resolve("config.json"), "{\"theme\": \"dark\"}");

        assertThat(locator().locate()).isEmpty();
    }

    @Test
    void missingSiblingIsEmpty() {
        assertThat(locator().locate()).isEmpty();
    }
}
