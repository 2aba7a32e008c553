package com.programmersdiary.promptalchemy.enhance;

public class AdmissionDeniedException extends IllegalStateException {

    public AdmissionDeniedException(String provider) {
        super("Rate limit wait for " + provider + " was cancelled");
    }
}
