package com.phoenix.worker.domain;

import java.util.List;
import java.util.UUID;

public record WorkflowResult(
    UUID contentId,
    String slug,
    double coverage,
    boolean partial,
    boolean degraded,
    long costMicros,
    int findingCount,
    List<MediaAsset> mediaAssets
) {
}
