package com.phoenix.worker.domain;

import java.time.Instant;
import java.util.Map;

public record ResearchFinding(
    String sourceUrl,
    SourceTier tier,
    int rank,
    double relevance,
    Map<String, String> facts,
    String excerpt,
    long costMicros,
    Instant retrievedAt
) {

    public static final String CRAWL_FAILED = "crawl-failed";

    public ResearchFinding {
        facts = facts == null ? Map.of() : Map.copyOf(facts);
        excerpt = excerpt == null ? "" : excerpt;
    }

    public boolean isUsable() {
        return !facts.containsKey(CRAWL_FAILED);
    }

    public ResearchFinding crawlFailed(String reason, long attemptCostMicros, Instant at) {
        return new ResearchFinding(
            sourceUrl,
            tier,
            rank,
            relevance,
            Map.of(CRAWL_FAILED, reason == null ? "unknown" : reason),
            excerpt,
            costMicros + attemptCostMicros,
            at
        );
    }
}
