package com.phoenix.worker.domain;

public record KnowledgeEntity(
    String name,
    String value,
    String sourceUrl,
    double relevance
) {
}
