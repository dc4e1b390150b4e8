package com.phoenix.worker.domain;

public record FailureReason(
    FailureKind kind,
    String activity,
    String message
) {

    public String describe() {
        return kind + " in " + activity + ": " + message;
    }
}
