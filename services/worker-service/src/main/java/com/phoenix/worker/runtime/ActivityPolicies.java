package com.phoenix.worker.runtime;

import com.phoenix.worker.config.WorkerProperties;
import java.time.Duration;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ActivityPolicies {

    private final WorkerProperties properties;

    public ActivityPolicies(WorkerProperties properties) {
        this.properties = properties;
    }

    public RetryPolicy policyFor(String activity) {
        Map<String, WorkerProperties.ActivityOverride> overrides = properties.getActivities();
        WorkerProperties.ActivityOverride override = overrides == null ? null : overrides.get(activity);

        int defaultAttempts = ActivityNames.CRAWL.equals(activity) ? properties.getCrawlMaxAttempts() : properties.getActivityMaxAttempts();
        int maxAttempts = override != null && override.getMaxAttempts() != null ? override.getMaxAttempts() : defaultAttempts;
        long timeoutMs = override != null && override.getTimeoutMs() != null
            ? override.getTimeoutMs()
            : properties.getActivityTimeoutMs();

        return new RetryPolicy(
            Math.max(1, maxAttempts),
            Duration.ofMillis(Math.max(1, timeoutMs)),
            Duration.ofMillis(Math.max(0, properties.getInitialBackoffMs())),
            Math.max(1.0, properties.getBackoffMultiplier()),
            Duration.ofMillis(Math.max(0, properties.getMaxBackoffMs()))
        );
    }
}
