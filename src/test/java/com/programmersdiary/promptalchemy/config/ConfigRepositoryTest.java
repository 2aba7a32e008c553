package com.programmersdiary.promptalchemy.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileLoadsDefaults() {
        var repository = new ConfigRepository(AppPaths.of(tempDir));
        repository.load();

        assertThat(repository.current().getDefaultProvider()).isEqualTo("openai");
        assertThat(repository.current().getDefaultModel()).isEqualTo("gpt-4o-mini");
        assertThat(repository.current().getEnhancementDefaults()).containsEntry("verbosity", "medium");
    }

    @Test
    void malformedFileLoadsDefaults() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), "{ broken");
        var repository = new ConfigRepository(AppPaths.of(tempDir));

        repository.load();

        assertThat(repository.current().getDefaultProvider()).isEqualTo("openai");
    }

    @Test
    void unknownFieldsSurviveSave() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), """
                {
                  "default_provider": "anthropic",
                  "window_geometry": {"width": 800},
                  "providers": {"openai": {"model": "gpt-4o", "organization": "org-1"}}
                }
                """);
        var repository = new ConfigRepository(AppPaths.of(tempDir));
        repository.load();

        repository.current().setDefaultModel("claude-sonnet-4-20250514");
        repository.save();

        var reloaded = new ConfigRepository(AppPaths.of(tempDir));
        reloaded.load();
        var config = reloaded.current();
        assertThat(config.getDefaultProvider()).isEqualTo("anthropic");
        assertThat(config.getDefaultModel()).isEqualTo("claude-sonnet-4-20250514");
        assertThat(config.other()).containsKey("window_geometry");
        assertThat(config.provider("OpenAI")).hasValueSatisfying(p -> {
            assertThat(p.getModel()).isEqualTo("gpt-4o");
            assertThat(p.other()).containsEntry("organization", "org-1");
        });
    }

    @Test
    void authModeOnlyAppliesToGoogleProviders() {
        var config = LocalConfig.defaults();
        config.setAuthMode(LocalConfig.AUTH_GCLOUD);
        config.setGcloudAuthValidated(true);

        assertThat(config.authModeFor("gemini")).isEqualTo(LocalConfig.AUTH_GCLOUD);
        assertThat(config.authModeFor("openai")).isEqualTo(LocalConfig.AUTH_API_KEY);
        assertThat(config.authValidatedFor("google")).isTrue();
        assertThat(config.authValidatedFor("anthropic")).isFalse();
    }
}
