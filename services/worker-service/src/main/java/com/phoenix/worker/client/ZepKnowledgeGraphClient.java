package com.phoenix.worker.client;

import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

@Component
public class ZepKnowledgeGraphClient implements KnowledgeGraphClient {

    private final RestClient restClient;

    public ZepKnowledgeGraphClient(@Qualifier("knowledgeRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<StoredKnowledge> lookup(String subjectId) {
        try {
            return Optional.ofNullable(restClient.get()
                .uri("/v2/graph/subjects/{subjectId}", subjectId)
                .retrieve()
                .body(StoredKnowledge.class));
        } catch (HttpClientErrorException.NotFound ex) {
            return Optional.empty();
        }
    }

    @Override
    public void write(String subjectId, StoredKnowledge knowledge) {
        restClient.put()
            .uri("/v2/graph/subjects/{subjectId}", subjectId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(knowledge)
            .retrieve()
            .toBodilessEntity();
    }
}
