package com.programmersdiary.promptalchemy.ratelimit;

import com.programmersdiary.promptalchemy.config.LocalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window admission control per provider. Every provider has its own window and
 * lock, and a blocking caller releases the lock while it waits, so a throttled provider
 * never holds up the others.
 */
public class RateGovernor {

    private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

    static final Duration WAIT_MARGIN = Duration.ofMillis(100);

    private final Clock clock;
    private final Sleeper sleeper;
    private final Quota defaultQuota;
    private final Map<String, Quota> quotas = new ConcurrentHashMap<>();
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public RateGovernor(Clock clock, Sleeper sleeper, Quota defaultQuota, Map<String, Quota> quotas) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.defaultQuota = defaultQuota;
        quotas.forEach(this::setQuota);
    }

    public static Map<String, Quota> defaultQuotas() {
        return Map.of(
                "openai", Quota.perWindow(50, 60),
                "anthropic", Quota.perWindow(50, 60),
                "google", Quota.perWindow(60, 60),
                "gemini", Quota.perWindow(60, 60));
    }

    public void setQuota(String provider, Quota quota) {
        quotas.put(LocalConfig.normalizeProvider(provider), quota);
    }

    public Quota quota(String provider) {
        return quotas.getOrDefault(LocalConfig.normalizeProvider(provider), defaultQuota);
    }

    /**
     * Tries to admit one call. Without {@code blocking} a full window means an immediate
     * {@code false}; with it the caller sleeps until a slot opens. Interrupting a blocked
     * caller abandons the attempt: the call is not recorded and {@code false} is returned
     * with the interrupt flag set.
     */
    public boolean admit(String provider, boolean blocking) {
        var id = LocalConfig.normalizeProvider(provider);
        var window = windows.computeIfAbsent(id, k -> new Window());
        while (true) {
            Duration wait;
            synchronized (window) {
                var quota = quota(id);
                var now = clock.instant();
                window.prune(now, quota.window());
                if (window.size() < quota.maxCalls()) {
                    window.record(now);
                    return true;
                }
                if (!blocking) {
                    log.debug("Rate limit reached for {}, call rejected", id);
                    return false;
                }
                wait = quota.window().minus(Duration.between(window.oldest(), now)).plus(WAIT_MARGIN);
            }
            if (wait.isNegative() || wait.isZero()) continue;
            log.info("Rate limit reached for {}. Waiting {}s...", id, String.format("%.1f", wait.toMillis() / 1000.0));
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Rate limit wait for {} interrupted", id);
                return false;
            }
        }
    }

    public RateStatus remaining(String provider) {
        var id = LocalConfig.normalizeProvider(provider);
        var quota = quota(id);
        var window = windows.get(id);
        if (window == null) {
            return new RateStatus(quota.maxCalls(), Duration.ZERO);
        }
        synchronized (window) {
            var now = clock.instant();
            window.prune(now, quota.window());
            var remaining = Math.max(0, quota.maxCalls() - window.size());
            if (window.size() == 0) {
                return new RateStatus(remaining, Duration.ZERO);
            }
            var resetIn = quota.window().minus(Duration.between(window.oldest(), now));
            if (resetIn.isNegative()) resetIn = Duration.ZERO;
            if (resetIn.compareTo(quota.window()) > 0) resetIn = quota.window();
            return new RateStatus(remaining, resetIn);
        }
    }

    private static final class Window {

        private final Deque<Instant> calls = new ArrayDeque<>();

        void prune(Instant now, Duration length) {
            var cutoff = now.minus(length);
            while (!calls.isEmpty() && !calls.peekFirst().isAfter(cutoff)) {
                calls.pollFirst();
            }
        }

        void record(Instant now) {
            calls.addLast(now);
        }

        int size() {
            return calls.size();
        }

        Instant oldest() {
            return calls.peekFirst();
        }
    }
}
