package com.phoenix.worker.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "content_media_assets")
public class MediaAssetEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "content_id", nullable = false)
    private UUID contentId;

    @Column(name = "role", nullable = false)
    private String role;

    @Column(name = "asset_url", nullable = false, length = 2048)
    private String assetUrl;

    public static MediaAssetEntity of(UUID contentId, MediaAsset asset) {
        MediaAssetEntity entity = new MediaAssetEntity();
        entity.id = UUID.randomUUID();
        entity.contentId = contentId;
        entity.role = asset.role();
        entity.assetUrl = asset.url();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getContentId() {
        return contentId;
    }

    public String getRole() {
        return role;
    }

    public String getAssetUrl() {
        return assetUrl;
    }

    public MediaAsset toAsset() {
        return new MediaAsset(role, assetUrl);
    }
}
