package com.phoenix.worker.domain;

public enum WorkflowState {
    CREATED,
    KNOWLEDGE_CHECK,
    RESEARCHING,
    SYNTHESIZING,
    GENERATING,
    PERSISTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
