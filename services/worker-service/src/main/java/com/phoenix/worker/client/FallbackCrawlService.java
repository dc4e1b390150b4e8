package com.phoenix.worker.client;

import com.phoenix.worker.runtime.TransientActivityException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries the configured crawl providers in order and returns the first page with content any of them delivers.
 * Fails as transient only when every provider failed, so the crawl activity may be retried as a whole.
 */
public class FallbackCrawlService implements CrawlService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackCrawlService.class);

    private final List<CrawlService> providers;

    public FallbackCrawlService(List<CrawlService> providers) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("at least one crawl provider is required");
        }
        this.providers = List.copyOf(providers);
    }

    @Override
    public String name() {
        return "fallback" + providers.stream().map(CrawlService::name).toList();
    }

    @Override
    public CrawlPage fetch(String url) {
        RuntimeException lastError = null;
        for (int index = 0; index < providers.size(); index++) {
            CrawlService provider = providers.get(index);
            try {
                CrawlPage page = provider.fetch(url);
                if (page == null || page.text() == null || page.text().isBlank()) {
                    throw new TransientActivityException(provider.name() + " returned no content for " + url);
                }
                if (index > 0) {
                    LOGGER.info("Crawl of {} served by fallback provider {}", url, provider.name());
                }
                return page;
            } catch (RuntimeException ex) {
                lastError = ex;
                LOGGER.warn("Crawl provider {} failed for {}: {}", provider.name(), url, ex.getMessage());
            }
        }
        throw new TransientActivityException(
            "all " + providers.size() + " crawl providers failed for " + url + ": " + lastError.getMessage(), lastError);
    }
}
