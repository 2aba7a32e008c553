package com.programmersdiary.promptalchemy.config;

import com.programmersdiary.promptalchemy.credential.CredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Copies credentials and Google Cloud auth settings from a sibling application's config
 * into ours. A field is only copied while ours has no value for it, so running the import
 * again is harmless.
 */
@Component
public class ConfigImportMerger {

    private static final Logger log = LoggerFactory.getLogger(ConfigImportMerger.class);

    private final ConfigRepository configRepository;
    private final CredentialVault credentialVault;

    public ConfigImportMerger(ConfigRepository configRepository, CredentialVault credentialVault) {
        this.configRepository = configRepository;
        this.credentialVault = credentialVault;
    }

    public boolean importOnce(LocalConfig source) {
        if (source == null) {
            return false;
        }
        var local = configRepository.current();
        var imported = false;

        for (var entry : source.getProviders().entrySet()) {
            var settings = entry.getValue();
            if (settings == null || !settings.hasApiKey()) continue;
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                log.warn("Skipping imported API key without a provider name");
                continue;
            }
            var provider = LocalConfig.normalizeProvider(entry.getKey());
            if (credentialVault.get(provider).isPresent()) continue;
            try {
                credentialVault.set(provider, settings.getApiKey());
                log.info("Imported API key for {}", provider);
                imported = true;
            } catch (RuntimeException e) {
                log.warn("Could not import API key for {}: {}", provider, e.getMessage());
            }
        }

        if (isBlank(local.getAuthMode()) && !isBlank(source.getAuthMode())) {
            local.setAuthMode(normalizeAuthMode(source.getAuthMode()));
            imported = true;
        }
        if (isBlank(local.getGcloudProjectId()) && !isBlank(source.getGcloudProjectId())) {
            local.setGcloudProjectId(source.getGcloudProjectId());
            imported = true;
        }
        if (local.getGcloudAuthValidated() == null && source.getGcloudAuthValidated() != null) {
            local.setGcloudAuthValidated(source.getGcloudAuthValidated());
            imported = true;
        }
        return imported;
    }

    static String normalizeAuthMode(String mode) {
        return switch (mode.trim()) {
            case "api_key", "API Key" -> LocalConfig.AUTH_API_KEY;
            case "Google Cloud Account" -> LocalConfig.AUTH_GCLOUD;
            default -> mode.trim();
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
