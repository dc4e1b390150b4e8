package com.phoenix.worker.domain;

public enum KnowledgeSource {
    STORE,
    MISS,
    UNAVAILABLE
}
