package com.phoenix.worker.domain;

public enum SourceTier {
    SEARCH_SNIPPET,
    CRAWLED_FULL,
    ESCALATED
}
