package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.phoenix.worker.config.WorkerProperties;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    @DisplayName("backoff grows by the multiplier and is capped")
    void exponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofMillis(500), 2.0, Duration.ofMillis(3_000));

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(1_000));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(2_000));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofMillis(3_000));
    }

    @Test
    @DisplayName("at least one attempt is required")
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ZERO, 2.0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("crawls default to their own attempt budget and overrides win over defaults")
    void policiesPerActivity() {
        WorkerProperties properties = new WorkerProperties();
        properties.setActivityMaxAttempts(3);
        properties.setCrawlMaxAttempts(2);
        WorkerProperties.ActivityOverride generation = new WorkerProperties.ActivityOverride();
        generation.setMaxAttempts(5);
        generation.setTimeoutMs(120_000L);
        properties.setActivities(Map.of(ActivityNames.GENERATE_DRAFT, generation));
        ActivityPolicies policies = new ActivityPolicies(properties);

        assertThat(policies.policyFor(ActivityNames.SEARCH).maxAttempts()).isEqualTo(3);
        assertThat(policies.policyFor(ActivityNames.CRAWL).maxAttempts()).isEqualTo(2);
        assertThat(policies.policyFor(ActivityNames.GENERATE_DRAFT).maxAttempts()).isEqualTo(5);
        assertThat(policies.policyFor(ActivityNames.GENERATE_DRAFT).timeout()).isEqualTo(Duration.ofMinutes(2));
    }
}
