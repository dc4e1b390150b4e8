package com.phoenix.worker.runtime;

public class TransientActivityException extends ActivityException {

    public TransientActivityException(String message) {
        super(message);
    }

    public TransientActivityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
