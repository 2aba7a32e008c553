package com.programmersdiary.promptalchemy.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Configuration
public class RateLimitConfig {

    @Bean
    public RateGovernor rateGovernor(Clock clock,
                                     @Value("${promptalchemy.rate-limit.default-calls:100}") int defaultCalls,
                                     @Value("${promptalchemy.rate-limit.default-window-seconds:60}") long defaultWindow,
                                     @Value("${promptalchemy.rate-limit.quotas:}") String overrides) {
        var quotas = new HashMap<>(RateGovernor.defaultQuotas());
        quotas.putAll(parseQuotas(overrides));
        return new RateGovernor(clock, Sleeper.THREAD, Quota.perWindow(defaultCalls, defaultWindow), quotas);
    }

    static Map<String, Quota> parseQuotas(String overrides) {
        var result = new HashMap<String, Quota>();
        if (overrides == null || overrides.isBlank()) return result;
        for (var entry : overrides.split(",")) {
            var trimmed = entry.trim();
            if (trimmed.isEmpty()) continue;
            var colon = trimmed.indexOf(':');
            var slash = trimmed.indexOf('/', colon + 1);
            if (colon <= 0 || slash < 0) {
                throw new IllegalArgumentException("Invalid rate limit entry '" + trimmed + "', expected provider:calls/seconds");
            }
            var provider = trimmed.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            var calls = Integer.parseInt(trimmed.substring(colon + 1, slash).trim());
            var seconds = Long.parseLong(trimmed.substring(slash + 1).trim());
            result.put(provider, Quota.perWindow(calls, seconds));
        }
        return result;
    }
}
