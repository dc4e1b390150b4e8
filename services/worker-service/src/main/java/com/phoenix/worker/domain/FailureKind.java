package com.phoenix.worker.domain;

public enum FailureKind {
    TRANSIENT,
    VALIDATION
}
