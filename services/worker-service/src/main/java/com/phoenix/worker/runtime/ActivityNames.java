package com.phoenix.worker.runtime;

/**
 * Activity names used for retry policies, attempt counters and idempotency keys.
 */
public final class ActivityNames {

    public static final String KNOWLEDGE_LOOKUP = "knowledge-lookup";
    public static final String SEARCH = "search";
    public static final String CRAWL = "crawl";
    public static final String ESCALATION = "escalation";
    public static final String KNOWLEDGE_DEPOSIT = "knowledge-deposit";
    public static final String GENERATE_DRAFT = "generate-draft";
    public static final String GENERATE_MEDIA = "generate-media";
    public static final String PERSIST = "persist";

    private ActivityNames() {
    }
}
