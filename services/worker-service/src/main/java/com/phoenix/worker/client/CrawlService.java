package com.phoenix.worker.client;

public interface CrawlService {

    /**
     * Fetches and extracts one page. Throws a transient activity error when the page could not be crawled.
     */
    CrawlPage fetch(String url);

    default String name() {
        return getClass().getSimpleName();
    }
}
