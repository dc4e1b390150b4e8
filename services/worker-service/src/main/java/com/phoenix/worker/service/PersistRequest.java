package com.phoenix.worker.service;

import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.domain.Subject;
import java.util.List;
import java.util.UUID;

public record PersistRequest(
    UUID instanceId,
    Subject subject,
    ContentDraft draft,
    List<ResearchFinding> findings,
    List<MediaAsset> mediaAssets,
    double coverage,
    boolean partialCoverage
) {

    public PersistRequest {
        findings = findings == null ? List.of() : List.copyOf(findings);
        mediaAssets = mediaAssets == null ? List.of() : List.copyOf(mediaAssets);
    }
}
