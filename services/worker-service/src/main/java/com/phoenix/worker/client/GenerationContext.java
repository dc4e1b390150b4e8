package com.phoenix.worker.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phoenix.worker.domain.WorkflowKind;
import java.util.List;
import java.util.Map;

/**
 * Merged, deduplicated context handed to content generation.
 */
public record GenerationContext(
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("subject_name") String subjectName,
    WorkflowKind kind,
    String narrative,
    Map<String, String> facts,
    List<SourceRef> sources,
    double coverage,
    boolean partial
) {

    public record SourceRef(
        String url,
        String tier,
        double relevance,
        String excerpt
    ) {
    }
}
