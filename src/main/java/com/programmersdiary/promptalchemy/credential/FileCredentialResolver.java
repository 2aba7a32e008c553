package com.programmersdiary.promptalchemy.credential;

import com.programmersdiary.promptalchemy.config.ConfigRepository;
import com.programmersdiary.promptalchemy.config.ProviderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class FileCredentialResolver implements CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(FileCredentialResolver.class);

    private final ConfigRepository configRepository;

    public FileCredentialResolver(ConfigRepository configRepository) {
        this.configRepository = configRepository;
    }

    @Override
    public String name() {
        return "file";
    }

    @Override
    public Optional<String> get(String provider) {
        return configRepository.current().provider(provider)
                .filter(ProviderSettings::hasApiKey)
                .map(ProviderSettings::getApiKey);
    }

    @Override
    public boolean set(String provider, String secret) {
        try {
            configRepository.current().providerForUpdate(provider).setApiKey(secret);
            configRepository.save();
            log.info("API key for {} stored in config file", provider);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to store key for {} in config file: {}", provider, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean delete(String provider) {
        var settings = configRepository.current().provider(provider);
        if (settings.isEmpty() || !settings.get().hasApiKey()) return false;
        try {
            settings.get().setApiKey(null);
            configRepository.save();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to remove key for {} from config file: {}", provider, e.getMessage());
            return false;
        }
    }
}
