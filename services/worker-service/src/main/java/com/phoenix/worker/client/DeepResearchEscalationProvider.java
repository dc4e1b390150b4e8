package com.phoenix.worker.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@ConditionalOnProperty(prefix = "providers", name = "escalation-base-url")
public class DeepResearchEscalationProvider implements EscalationProvider {

    private final RestClient restClient;

    public DeepResearchEscalationProvider(@Qualifier("escalationRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<EscalationHit> research(EscalationRequest request) {
        GapResponse response = restClient.post()
            .uri("/v1/research/gap")
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of(
                "subject", request.subject(),
                "kind", request.kind().name().toLowerCase(Locale.ROOT),
                "missing_fields", request.missingFields().stream().sorted().toList(),
                "exclude_urls", request.excludeUrls().stream().sorted().toList()
            ))
            .retrieve()
            .body(GapResponse.class);

        if (response == null || response.results() == null) {
            return List.of();
        }
        return response.results().stream()
            .filter(r -> r.url() != null && !r.url().isBlank())
            .map(r -> new EscalationHit(r.url(), r.text(), r.facts() == null ? Map.of() : r.facts(), r.score()))
            .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GapResponse(List<GapResult> results) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GapResult(String url, String text, Map<String, String> facts, double score) {
    }
}
