package com.programmersdiary.promptalchemy.ratelimit;

import java.time.Duration;

public record RateStatus(int remaining, Duration resetIn) {

    public double secondsUntilReset() {
        return resetIn.toMillis() / 1000.0;
    }
}
