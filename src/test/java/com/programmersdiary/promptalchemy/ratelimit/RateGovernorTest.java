package com.programmersdiary.promptalchemy.ratelimit;

import com.programmersdiary.promptalchemy.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateGovernorTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private RateGovernor governor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-18T08:00:00Z"));
        sleeps = new ArrayList<>();
        Sleeper advancing = duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        };
        governor = new RateGovernor(clock, advancing, Quota.perWindow(100, 60),
                Map.of("openai", Quota.perWindow(3, 60)));
    }

    @Test
    void admitsUpToQuotaThenRejects() {
        assertThat(governor.admit("openai", false)).isTrue();
        assertThat(governor.admit("openai", false)).isTrue();
        assertThat(governor.admit("openai", false)).isTrue();

        assertThat(governor.admit("openai", false)).isFalse();
        assertThat(governor.remaining("openai").remaining()).isZero();
    }

    @Test
    void slotsReopenOnceWindowHasPassed() {
        for (int i = 0; i < 3; i++) {
            governor.admit("openai", false);
            clock.advance(Duration.ofSeconds(10));
        }
        assertThat(governor.admit("openai", false)).isFalse();

        // the call made at t=0 has left the window by t=60
        clock.advance(Duration.ofSeconds(30));
        assertThat(governor.admit("openai", false)).isTrue();
        assertThat(governor.admit("openai", false)).isFalse();
    }

    @Test
    void providersAreIndependentAndCaseInsensitive() {
        for (int i = 0; i < 3; i++) {
            governor.admit("OpenAI", false);
        }

        assertThat(governor.admit("openai", false)).isFalse();
        assertThat(governor.admit("anthropic", false)).isTrue();
        assertThat(governor.remaining("anthropic").remaining()).isEqualTo(99);
    }

    @Test
    void unknownProviderUsesDefaultQuota() {
        assertThat(governor.quota("mistral")).isEqualTo(Quota.perWindow(100, 60));
        assertThat(governor.remaining("mistral")).isEqualTo(new RateStatus(100, Duration.ZERO));
    }

    @Test
    void remainingReportsTimeUntilOldestCallExpires() {
        governor.admit("openai", false);
        clock.advance(Duration.ofSeconds(20));
        governor.admit("openai", false);

        var status = governor.remaining("openai");

        assertThat(status.remaining()).isEqualTo(1);
        assertThat(status.resetIn()).isEqualTo(Duration.ofSeconds(40));
        assertThat(status.secondsUntilReset()).isEqualTo(40.0);
    }

    @Test
    void remainingNeverGoesNegativeAfterQuotaShrinks() {
        for (int i = 0; i < 3; i++) {
            governor.admit("openai", false);
        }
        governor.setQuota("openai", Quota.perWindow(1, 60));

        var status = governor.remaining("openai");

        assertThat(status.remaining()).isZero();
        assertThat(status.resetIn()).isBetween(Duration.ZERO, Duration.ofSeconds(60));
    }

    @Test
    void blockingAdmitWaitsForOldestSlot() {
        for (int i = 0; i < 3; i++) {
            governor.admit("openai", false);
        }

        assertThat(governor.admit("openai", true)).isTrue();

        assertThat(sleeps).containsExactly(Duration.ofSeconds(60).plus(RateGovernor.WAIT_MARGIN));
        assertThat(governor.remaining("openai").remaining()).isEqualTo(2);
    }

    @Test
    void interruptedWaitIsNotRecorded() {
        Sleeper interrupted = duration -> {
            throw new InterruptedException();
        };
        var blocking = new RateGovernor(clock, interrupted, Quota.perWindow(1, 60), Map.of());
        blocking.admit("openai", false);

        try {
            assertThat(blocking.admit("openai", true)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(blocking.remaining("openai").remaining()).isZero();
    }

    @Test
    void throttledProviderDoesNotBlockOthers() throws Exception {
        var shared = new RateGovernor(Clock.systemUTC(), Sleeper.THREAD, Quota.perWindow(1, 60), Map.of());
        shared.admit("openai", false);

        var waiter = new Thread(() -> shared.admit("openai", true));
        waiter.start();
        try {
            Thread.sleep(100);
            var started = System.nanoTime();
            assertThat(shared.admit("anthropic", false)).isTrue();
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
        } finally {
            waiter.interrupt();
            waiter.join(5000);
        }
        assertThat(waiter.isAlive()).isFalse();
    }

    @Test
    void concurrentCallersNeverExceedQuota() throws Exception {
        var shared = new RateGovernor(clock, Sleeper.THREAD, Quota.perWindow(100, 60),
                Map.of("openai", Quota.perWindow(5, 60)));
        int callers = 16;
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(callers);
        try {
            var results = new ArrayList<Future<Boolean>>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return shared.admit("openai", false);
                }));
            }
            start.countDown();

            int admitted = 0;
            for (var result : results) {
                if (result.get(5, TimeUnit.SECONDS)) admitted++;
            }
            assertThat(admitted).isEqualTo(5);
            assertThat(shared.remaining("openai").remaining()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void quotaRejectsNonPositiveValues() {
        assertThatThrownBy(() -> Quota.perWindow(0, 60)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Quota.perWindow(5, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Quota(5, Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultQuotasCoverKnownProviders() {
        var defaults = RateGovernor.defaultQuotas();

        assertThat(defaults.get("openai")).isEqualTo(Quota.perWindow(50, 60));
        assertThat(defaults.get("anthropic")).isEqualTo(Quota.perWindow(50, 60));
        assertThat(defaults.get("google")).isEqualTo(Quota.perWindow(60, 60));
        assertThat(defaults.get("gemini")).isEqualTo(Quota.perWindow(60, 60));
    }
}
