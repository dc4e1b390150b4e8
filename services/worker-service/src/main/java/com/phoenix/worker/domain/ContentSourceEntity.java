package com.phoenix.worker.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "content_sources")
public class ContentSourceEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "content_id", nullable = false)
    private UUID contentId;

    @Column(name = "source_url", nullable = false, length = 2048)
    private String sourceUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false)
    private SourceTier tier;

    @Column(name = "relevance", nullable = false)
    private double relevance;

    public static ContentSourceEntity of(UUID contentId, ResearchFinding finding) {
        ContentSourceEntity entity = new ContentSourceEntity();
        entity.id = UUID.randomUUID();
        entity.contentId = contentId;
        entity.sourceUrl = finding.sourceUrl();
        entity.tier = finding.tier();
        entity.relevance = finding.relevance();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getContentId() {
        return contentId;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public SourceTier getTier() {
        return tier;
    }

    public double getRelevance() {
        return relevance;
    }
}
