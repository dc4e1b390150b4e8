package com.phoenix.worker.client;

import com.phoenix.worker.domain.WorkflowKind;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Optional, higher-cost research provider asked only for the fields cheaper stages could not cover.
 */
public interface EscalationProvider {

    List<EscalationHit> research(EscalationRequest request);

    record EscalationRequest(
        String subject,
        WorkflowKind kind,
        Set<String> missingFields,
        Set<String> excludeUrls
    ) {
    }

    record EscalationHit(
        String url,
        String text,
        Map<String, String> facts,
        double score
    ) {
    }
}
