package com.phoenix.worker.research;

import com.phoenix.worker.domain.ResearchFinding;
import java.util.List;

/**
 * Outcome of one funnel run.
 *
 * @param partial the cost ceiling stopped research before coverage reached the threshold
 * @param degraded the escalation provider was configured but failed
 */
public record FunnelResult(
    List<ResearchFinding> findings,
    double coverage,
    boolean partial,
    boolean degraded,
    long costMicros,
    int crawledWordCount
) {

    public FunnelResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public long usableCount() {
        return findings.stream().filter(ResearchFinding::isUsable).count();
    }
}
