package com.phoenix.worker.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "generated_content")
public class GeneratedContentEntity {

    @Id
    @Column(name = "instance_id", nullable = false, updatable = false)
    private UUID instanceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false)
    private WorkflowKind kind;

    @Column(name = "subject_id", nullable = false)
    private String subjectId;

    @Column(name = "slug", nullable = false)
    private String slug;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "summary", length = 4000)
    private String summary;

    @Lob
    @Column(name = "body")
    private String body;

    @Lob
    @Column(name = "payload")
    private String payload;

    @Column(name = "coverage", nullable = false)
    private double coverage;

    @Column(name = "partial_coverage", nullable = false)
    private boolean partialCoverage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static GeneratedContentEntity of(
        UUID instanceId,
        Subject subject,
        ContentDraft draft,
        String payload,
        double coverage,
        boolean partialCoverage
    ) {
        GeneratedContentEntity entity = new GeneratedContentEntity();
        entity.instanceId = instanceId;
        entity.kind = subject.kind();
        entity.subjectId = subject.id();
        entity.slug = draft.slug() == null || draft.slug().isBlank() ? subject.id() : draft.slug();
        entity.title = draft.title() == null || draft.title().isBlank() ? subject.displayName() : draft.title();
        entity.summary = draft.summary();
        entity.body = draft.body();
        entity.payload = payload;
        entity.coverage = coverage;
        entity.partialCoverage = partialCoverage;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public UUID getInstanceId() {
        return instanceId;
    }

    public WorkflowKind getKind() {
        return kind;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getSlug() {
        return slug;
    }

    public String getTitle() {
        return title;
    }

    public String getSummary() {
        return summary;
    }

    public String getBody() {
        return body;
    }

    public String getPayload() {
        return payload;
    }

    public double getCoverage() {
        return coverage;
    }

    public boolean isPartialCoverage() {
        return partialCoverage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
