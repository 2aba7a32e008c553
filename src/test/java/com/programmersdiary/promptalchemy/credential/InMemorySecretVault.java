package com.programmersdiary.promptalchemy.credential;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

class InMemorySecretVault implements SecretVault {

    private final Map<String, String> entries = new HashMap<>();
    private boolean available = true;
    private boolean failWrites;

    void setAvailable(boolean available) {
        this.available = available;
    }

    void failWrites() {
        this.failWrites = true;
    }

    void put(String namespace, String account, String secret) {
        entries.put(namespace + "/" + account, secret);
    }

    Optional<String> peek(String namespace, String account) {
        return Optional.ofNullable(entries.get(namespace + "/" + account));
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Optional<String> read(String namespace, String account) {
        if (!available) throw new VaultException("unavailable");
        return peek(namespace, account);
    }

    @Override
    public void write(String namespace, String account, String secret) {
        if (!available || failWrites) throw new VaultException("write refused");
        put(namespace, account, secret);
    }

    @Override
    public void delete(String namespace, String account) {
        if (!available) throw new VaultException("unavailable");
        entries.remove(namespace + "/" + account);
    }
}
