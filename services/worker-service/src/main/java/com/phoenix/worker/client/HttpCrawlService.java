package com.phoenix.worker.client;

import com.phoenix.worker.runtime.TransientActivityException;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * One crawl endpoint speaking {@code POST <path> {url}} and answering
 * {@code {success, url, title, content, facts, error}}.
 */
public class HttpCrawlService implements CrawlService {

    private final String providerName;
    private final RestClient restClient;
    private final String path;

    public HttpCrawlService(String providerName, RestClient restClient, String path) {
        this.providerName = providerName;
        this.restClient = restClient;
        this.path = path;
    }

    @Override
    public String name() {
        return providerName;
    }

    @Override
    public CrawlPage fetch(String url) {
        CrawlResponse response = restClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("url", url))
            .retrieve()
            .body(CrawlResponse.class);

        if (response == null) {
            throw new TransientActivityException(providerName + " returned an empty body for " + url);
        }
        if (!response.success()) {
            String error = response.error() == null || response.error().isBlank() ? "crawl unsuccessful" : response.error();
            throw new TransientActivityException("Crawl failed for " + url + " at " + providerName + ": " + error);
        }
        return new CrawlPage(
            url,
            response.title(),
            response.content(),
            response.facts() == null ? Map.of() : response.facts()
        );
    }
}
