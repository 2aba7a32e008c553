package com.programmersdiary.promptalchemy.ratelimit;

import java.time.Duration;

public record Quota(int maxCalls, Duration window) {

    public Quota {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be at least 1, was " + maxCalls);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, was " + window);
        }
    }

    public static Quota perWindow(int maxCalls, long windowSeconds) {
        return new Quota(maxCalls, Duration.ofSeconds(windowSeconds));
    }
}
