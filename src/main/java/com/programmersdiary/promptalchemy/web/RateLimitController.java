package com.programmersdiary.promptalchemy.web;

import com.programmersdiary.promptalchemy.config.LocalConfig;
import com.programmersdiary.promptalchemy.ratelimit.RateGovernor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rate-limits")
public class RateLimitController {

    private final RateGovernor rateGovernor;

    public RateLimitController(RateGovernor rateGovernor) {
        this.rateGovernor = rateGovernor;
    }

    public record RateLimitResponse(String provider, int maxCalls, long windowSeconds,
                                    int remaining, double secondsUntilReset) {
    }

    @GetMapping("/{provider}")
    public RateLimitResponse get(@PathVariable String provider) {
        var quota = rateGovernor.quota(provider);
        var status = rateGovernor.remaining(provider);
        return new RateLimitResponse(LocalConfig.normalizeProvider(provider), quota.maxCalls(),
                quota.window().toSeconds(), status.remaining(), status.secondsUntilReset());
    }
}
