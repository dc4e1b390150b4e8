package com.phoenix.worker.runtime;

import com.phoenix.worker.domain.FailureReason;

/**
 * An activity gave up: either its attempts are exhausted or the error was not retryable.
 */
public class ActivityFailedException extends RuntimeException {

    private final FailureReason reason;

    public ActivityFailedException(FailureReason reason, Throwable cause) {
        super(reason.describe(), cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
