package com.phoenix.worker.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredKnowledge(
    @JsonProperty("subject_id") String subjectId,
    String kind,
    double coverage,
    String narrative,
    List<StoredEntity> entities,
    @JsonProperty("last_updated") Instant lastUpdated
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StoredEntity(
        String name,
        String value,
        @JsonProperty("source_url") String sourceUrl,
        double relevance
    ) {
    }
}
