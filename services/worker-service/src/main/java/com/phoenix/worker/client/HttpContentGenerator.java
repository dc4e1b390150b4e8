package com.phoenix.worker.client;

import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.runtime.ValidationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HttpContentGenerator implements ContentGenerator {

    private final RestClient restClient;

    public HttpContentGenerator(@Qualifier("generationRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public ContentDraft generateCompanyProfile(GenerationContext context) {
        return generate("/v1/generate/company-profile", context);
    }

    @Override
    public ContentDraft generateArticle(GenerationContext context) {
        return generate("/v1/generate/article", context);
    }

    private ContentDraft generate(String path, GenerationContext context) {
        ContentDraft draft = restClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .body(context)
            .retrieve()
            .body(ContentDraft.class);

        if (draft == null || draft.body() == null || draft.body().isBlank()) {
            throw new ValidationException("Content generation returned an empty draft for " + context.subjectId());
        }
        return draft;
    }
}
