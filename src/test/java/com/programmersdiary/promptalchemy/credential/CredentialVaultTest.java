package com.programmersdiary.promptalchemy.credential;

import com.programmersdiary.promptalchemy.config.AppPaths;
import com.programmersdiary.promptalchemy.config.ConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialVaultTest {

    private static final String OWN = "PromptAlchemy";
    private static final String SIBLING = "ImageAI";

    @TempDir
    Path tempDir;

    private InMemorySecretVault secrets;
    private ConfigRepository configRepository;
    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        secrets = new InMemorySecretVault();
        configRepository = new ConfigRepository(AppPaths.of(tempDir));
        configRepository.load();
        vault = new CredentialVault(
                VaultCredentialResolver.owned(secrets, OWN),
                new FileCredentialResolver(configRepository),
                List.of(VaultCredentialResolver.foreign(secrets, SIBLING)));
    }

    @Test
    void storesInVaultWhenAvailable() {
        assertThat(vault.set("openai", "sk-test")).isTrue();

        assertThat(vault.get("openai")).contains("sk-test");
        assertThat(secrets.peek(OWN, "openai_api_key")).contains("sk-test");
        assertThat(configRepository.current().provider("openai")).isEmpty();
        assertThat(vault.storageLocation("openai")).isEqualTo(StorageLocation.VAULT);
    }

    @Test
    void providerIdIsCaseInsensitive() {
        vault.set("OpenAI", "sk-test");

        assertThat(vault.get("openai")).contains("sk-test");
        assertThat(vault.get(" OPENAI ")).contains("sk-test");
    }

    @Test
    void fallsBackToConfigFileWhenVaultUnavailable() throws Exception {
        secrets.setAvailable(false);

        assertThat(vault.set("anthropic", "sk-ant")).isFalse();

        assertThat(vault.get("anthropic")).contains("sk-ant");
        assertThat(vault.storageLocation("anthropic")).isEqualTo(StorageLocation.FILE);
        assertThat(Files.readString(tempDir.resolve("config.json"))).contains("\"api_key\" : \"sk-ant\"");
    }

    @Test
    void fallsBackToConfigFileWhenVaultRefusesWrite() {
        secrets.failWrites();

        assertThat(vault.set("anthropic", "sk-ant")).isFalse();

        assertThat(secrets.peek(OWN, "anthropic_api_key")).isEmpty();
        assertThat(vault.get("anthropic")).contains("sk-ant");
    }

    @Test
    void vaultTakesPrecedenceOverConfigFile() {
        configRepository.current().providerForUpdate("openai").setApiKey("from-file");
        secrets.put(OWN, "openai_api_key", "from-vault");

        assertThat(vault.get("openai")).contains("from-vault");
    }

    @Test
    void migratesKeyFromSiblingNamespace() {
        secrets.put(SIBLING, "google_api_key", "g-key");

        assertThat(vault.get("google")).contains("g-key");

        assertThat(secrets.peek(OWN, "google_api_key")).contains("g-key");
        assertThat(secrets.peek(SIBLING, "google_api_key")).contains("g-key");
    }

    @Test
    void missingKeyIsEmpty() {
        assertThat(vault.get("openai")).isEmpty();
        assertThat(vault.storageLocation("openai")).isEqualTo(StorageLocation.NONE);
    }

    @Test
    void unavailableVaultReadsAsAbsent() {
        secrets.put(OWN, "openai_api_key", "hidden");
        secrets.setAvailable(false);

        assertThat(vault.get("openai")).isEmpty();
    }

    @Test
    void blankSecretIsRejected() {
        assertThatThrownBy(() -> vault.set("openai", " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> vault.set("", "sk")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteRemovesFromBothStores() {
        secrets.put(OWN, "openai_api_key", "v");
        configRepository.current().providerForUpdate("openai").setApiKey("f");

        assertThat(vault.delete("openai")).isTrue();

        assertThat(vault.get("openai")).isEmpty();
        assertThat(vault.delete("openai")).isFalse();
    }

    @Test
    void deleteNeverTouchesSiblingNamespace() {
        secrets.put(SIBLING, "openai_api_key", "theirs");

        vault.delete("openai");

        assertThat(secrets.peek(SIBLING, "openai_api_key")).contains("theirs");
    }
}
