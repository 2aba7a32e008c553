package com.programmersdiary.promptalchemy.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class VaultCredentialResolver implements CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(VaultCredentialResolver.class);

    private final SecretVault vault;
    private final String namespace;
    private final boolean migrating;

    private VaultCredentialResolver(SecretVault vault, String namespace, boolean migrating) {
        this.vault = vault;
        this.namespace = namespace;
        this.migrating = migrating;
    }

    public static VaultCredentialResolver owned(SecretVault vault, String namespace) {
        return new VaultCredentialResolver(vault, namespace, false);
    }

    public static VaultCredentialResolver foreign(SecretVault vault, String namespace) {
        return new VaultCredentialResolver(vault, namespace, true);
    }

    static String account(String provider) {
        return provider + "_api_key";
    }

    @Override
    public String name() {
        return "vault:" + namespace;
    }

    @Override
    public Optional<String> get(String provider) {
        try {
            if (!vault.isAvailable()) return Optional.empty();
            return vault.read(namespace, account(provider));
        } catch (RuntimeException e) {
            log.debug("Vault lookup failed for {} in {}: {}", provider, namespace, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean set(String provider, String secret) {
        if (migrating) return false;
        try {
            if (!vault.isAvailable()) return false;
            vault.write(namespace, account(provider), secret);
            log.info("API key for {} stored in system keyring", provider);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to store key for {} in keyring: {}", provider, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean delete(String provider) {
        if (migrating) return false;
        try {
            if (!vault.isAvailable()) return false;
            if (vault.read(namespace, account(provider)).isEmpty()) return false;
            vault.delete(namespace, account(provider));
            log.info("API key for {} deleted from keyring", provider);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to delete key for {} from keyring: {}", provider, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean migrating() {
        return migrating;
    }
}
