package com.programmersdiary.promptalchemy.credential;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class KeyringSecretVault implements SecretVault {

    private static final Logger log = LoggerFactory.getLogger(KeyringSecretVault.class);

    private final boolean enabled;
    private Keyring keyring;
    private boolean probed;

    public KeyringSecretVault(@Value("${promptalchemy.vault.enabled:true}") boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public synchronized boolean isAvailable() {
        return keyring() != null;
    }

    @Override
    public synchronized Optional<String> read(String namespace, String account) {
        var backend = requireKeyring();
        try {
            var secret = backend.getPassword(namespace, account);
            return Optional.ofNullable(secret).filter(s -> !s.isEmpty());
        } catch (PasswordAccessException e) {
            log.debug("No vault entry {}/{}: {}", namespace, account, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void write(String namespace, String account, String secret) {
        var backend = requireKeyring();
        try {
            backend.setPassword(namespace, account, secret);
        } catch (PasswordAccessException e) {
            throw new VaultException("Failed to write vault entry " + namespace + "/" + account, e);
        }
    }

    @Override
    public synchronized void delete(String namespace, String account) {
        var backend = requireKeyring();
        try {
            backend.deletePassword(namespace, account);
        } catch (PasswordAccessException e) {
            throw new VaultException("Failed to delete vault entry " + namespace + "/" + account, e);
        }
    }

    @PreDestroy
    synchronized void close() {
        if (keyring == null) return;
        try {
            keyring.close();
        } catch (Exception e) {
            log.warn("Error closing keyring backend: {}", e.getMessage());
        }
        keyring = null;
    }

    private Keyring requireKeyring() {
        var backend = keyring();
        if (backend == null) {
            throw new VaultException("No secure credential vault on this platform");
        }
        return backend;
    }

    private Keyring keyring() {
        if (!enabled) return null;
        if (!probed) {
            probed = true;
            try {
                keyring = Keyring.create();
                log.info("Using system keyring for API keys");
            } catch (BackendNotSupportedException e) {
                log.info("System keyring not available, API keys will be stored in the config file");
            } catch (RuntimeException | LinkageError e) {
                log.warn("System keyring failed to initialise: {}", e.toString());
            }
        }
        return keyring;
    }
}
