package com.programmersdiary.promptalchemy.credential;

import java.util.Optional;

public interface CredentialResolver {

    String name();

    Optional<String> get(String provider);

    boolean set(String provider, String secret);

    boolean delete(String provider);

    default boolean migrating() {
        return false;
    }
}
