package com.programmersdiary.promptalchemy.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitConfigTest {

    @Test
    void parsesOverrides() {
        var quotas = RateLimitConfig.parseQuotas(" OpenAI:10/30 , anthropic:5/60,");

        assertThat(quotas).containsEntry("openai", Quota.perWindow(10, 30))
                .containsEntry("anthropic", Quota.perWindow(5, 60))
                .hasSize(2);
    }

    @Test
    void blankOverridesAreEmpty() {
        assertThat(RateLimitConfig.parseQuotas("")).isEmpty();
        assertThat(RateLimitConfig.parseQuotas(null)).isEmpty();
    }

    @Test
    void malformedOverridesAreRejected() {
        assertThatThrownBy(() -> RateLimitConfig.parseQuotas("openai=10/60"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RateLimitConfig.parseQuotas("openai:0/60"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overridesReplaceBuiltInQuotas() {
        var governor = new RateLimitConfig().rateGovernor(Clock.systemUTC(), 100, 60, "openai:2/10");

        assertThat(governor.quota("openai")).isEqualTo(Quota.perWindow(2, 10));
        assertThat(governor.quota("anthropic")).isEqualTo(Quota.perWindow(50, 60));
        assertThat(governor.quota("other")).isEqualTo(Quota.perWindow(100, 60));
    }
}
