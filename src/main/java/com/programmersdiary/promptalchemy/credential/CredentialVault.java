package com.programmersdiary.promptalchemy.credential;

import com.programmersdiary.promptalchemy.config.LocalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves provider API keys through an ordered chain: our own vault namespace, the config
 * file, then any foreign vault namespaces. A key found in a foreign namespace is copied into
 * our own so the next lookup stops at the first step.
 *
 * <p>Writes go to the vault, or to the config file when the vault refuses them; never both.
 */
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private final CredentialResolver primary;
    private final CredentialResolver fallback;
    private final List<CredentialResolver> chain;

    public CredentialVault(CredentialResolver primary, CredentialResolver fallback,
                           List<CredentialResolver> migrationSources) {
        this.primary = primary;
        this.fallback = fallback;
        var resolvers = new ArrayList<CredentialResolver>();
        resolvers.add(primary);
        resolvers.add(fallback);
        resolvers.addAll(migrationSources);
        this.chain = List.copyOf(resolvers);
    }

    public Optional<String> get(String provider) {
        var id = LocalConfig.normalizeProvider(provider);
        for (var resolver : chain) {
            var secret = resolver.get(id);
            if (secret.isEmpty()) continue;
            if (resolver.migrating()) {
                log.info("Imported API key for {} from {}", id, resolver.name());
                primary.set(id, secret.get());
            } else {
                log.debug("Resolved API key for {} from {}", id, resolver.name());
            }
            return secret;
        }
        return Optional.empty();
    }

    public boolean set(String provider, String secret) {
        var id = LocalConfig.normalizeProvider(provider);
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
        if (primary.set(id, secret)) {
            return true;
        }
        log.debug("Vault not available, using file storage for {}", id);
        if (!fallback.set(id, secret)) {
            throw new VaultException("Could not store API key for " + id);
        }
        return false;
    }

    public boolean delete(String provider) {
        var id = LocalConfig.normalizeProvider(provider);
        var fromVault = primary.delete(id);
        var fromFile = fallback.delete(id);
        return fromVault || fromFile;
    }

    public StorageLocation storageLocation(String provider) {
        var id = LocalConfig.normalizeProvider(provider);
        if (primary.get(id).isPresent()) return StorageLocation.VAULT;
        if (fallback.get(id).isPresent()) return StorageLocation.FILE;
        return StorageLocation.NONE;
    }
}
