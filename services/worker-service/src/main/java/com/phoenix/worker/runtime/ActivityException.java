package com.phoenix.worker.runtime;

/**
 * Raised by an activity. Subclasses decide whether the activity may be retried.
 */
public abstract class ActivityException extends RuntimeException {

    protected ActivityException(String message) {
        super(message);
    }

    protected ActivityException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
