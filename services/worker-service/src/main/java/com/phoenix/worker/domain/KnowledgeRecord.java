package com.phoenix.worker.domain;

import java.time.Instant;
import java.util.Map;

/**
 * What the knowledge store knows about a subject. Coverage never decreases across
 * successive enrichments and deposits of the same subject.
 */
public record KnowledgeRecord(
    String subjectId,
    WorkflowKind kind,
    double coverage,
    String narrative,
    Map<String, KnowledgeEntity> entities,
    Instant lastUpdated,
    KnowledgeSource source
) {

    public KnowledgeRecord {
        narrative = narrative == null ? "" : narrative;
        entities = entities == null ? Map.of() : Map.copyOf(entities);
        source = source == null ? KnowledgeSource.STORE : source;
    }

    public static KnowledgeRecord empty(Subject subject, KnowledgeSource source) {
        return new KnowledgeRecord(subject.id(), subject.kind(), 0.0, "", Map.of(), null, source);
    }

    public boolean isDegraded() {
        return source == KnowledgeSource.UNAVAILABLE;
    }
}
