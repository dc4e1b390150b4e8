package com.phoenix.worker.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.runtime.TransientActivityException;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HttpMediaGenerator implements MediaGenerator {

    private final RestClient restClient;

    public HttpMediaGenerator(@Qualifier("mediaRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public MediaAsset generateAsset(String subjectId, String role, String prompt) {
        AssetResponse response = restClient.post()
            .uri("/v1/assets")
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("subject", subjectId, "role", role, "prompt", prompt))
            .retrieve()
            .body(AssetResponse.class);

        if (response == null || response.assetUrl() == null || response.assetUrl().isBlank()) {
            throw new TransientActivityException("Media service returned no asset url for " + subjectId + "/" + role);
        }
        return new MediaAsset(role, response.assetUrl());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AssetResponse(@JsonProperty("asset_url") String assetUrl) {
    }
}
