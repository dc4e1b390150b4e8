package com.phoenix.worker.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class SerperSearchProvider implements SearchProvider {

    private final RestClient restClient;

    public SerperSearchProvider(@Qualifier("searchRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<SearchHit> search(String query, int page, int resultsPerPage) {
        SerperNewsResponse response = restClient.post()
            .uri("/news")
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("q", query, "num", resultsPerPage, "page", page))
            .retrieve()
            .body(SerperNewsResponse.class);

        if (response == null || response.news() == null) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        int offset = (page - 1) * resultsPerPage;
        for (int i = 0; i < response.news().size(); i++) {
            SerperNewsResponse.Item item = response.news().get(i);
            if (item.link() == null || item.link().isBlank()) {
                continue;
            }
            int position = item.position() == null || item.position() <= 0 ? i + 1 : item.position();
            hits.add(new SearchHit(item.link().trim(), safe(item.title()), safe(item.snippet()), offset + position));
        }
        return hits;
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
