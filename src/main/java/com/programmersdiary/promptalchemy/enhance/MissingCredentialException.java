package com.programmersdiary.promptalchemy.enhance;

public class MissingCredentialException extends IllegalStateException {

    public MissingCredentialException(String provider) {
        super("No API key configured for " + provider);
    }
}
