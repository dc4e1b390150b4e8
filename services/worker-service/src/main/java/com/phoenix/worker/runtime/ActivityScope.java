package com.phoenix.worker.runtime;

import java.util.UUID;

/**
 * The owner of an activity invocation: keys idempotency and counts attempts.
 */
public interface ActivityScope {

    UUID instanceId();

    void recordAttempt(String activity);
}
