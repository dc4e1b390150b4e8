package com.phoenix.worker.domain;

import java.util.Locale;

public enum WorkflowKind {
    COMPANY,
    ARTICLE;

    public static WorkflowKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Workflow kind must not be blank");
        }
        try {
            return WorkflowKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported workflow kind: " + value);
        }
    }
}
