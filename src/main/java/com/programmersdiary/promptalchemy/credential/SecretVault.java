package com.programmersdiary.promptalchemy.credential;

import java.util.Optional;

public interface SecretVault {

    boolean isAvailable();

    Optional<String> read(String namespace, String account);

    void write(String namespace, String account, String secret);

    void delete(String namespace, String account);
}
