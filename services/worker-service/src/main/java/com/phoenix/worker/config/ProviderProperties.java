package com.phoenix.worker.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "providers")
public class ProviderProperties {

    private String knowledgeBaseUrl = "https://api.getzep.com";
    private String knowledgeApiKey = "";
    private String searchBaseUrl = "https://google.serper.dev";
    private String searchApiKey = "";
    private String crawlBaseUrl = "http://localhost:8001";
    private List<CrawlProvider> crawlProviders = new ArrayList<>();
    private String escalationBaseUrl;
    private String escalationApiKey = "";
    private String generationBaseUrl = "http://localhost:8000";
    private String mediaBaseUrl = "http://localhost:8003";
    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 60_000;

    public String getKnowledgeBaseUrl() {
        return knowledgeBaseUrl;
    }

    public void setKnowledgeBaseUrl(String knowledgeBaseUrl) {
        this.knowledgeBaseUrl = knowledgeBaseUrl;
    }

    public String getKnowledgeApiKey() {
        return knowledgeApiKey;
    }

    public void setKnowledgeApiKey(String knowledgeApiKey) {
        this.knowledgeApiKey = knowledgeApiKey;
    }

    public String getSearchBaseUrl() {
        return searchBaseUrl;
    }

    public void setSearchBaseUrl(String searchBaseUrl) {
        this.searchBaseUrl = searchBaseUrl;
    }

    public String getSearchApiKey() {
        return searchApiKey;
    }

    public void setSearchApiKey(String searchApiKey) {
        this.searchApiKey = searchApiKey;
    }

    public String getCrawlBaseUrl() {
        return crawlBaseUrl;
    }

    public void setCrawlBaseUrl(String crawlBaseUrl) {
        this.crawlBaseUrl = crawlBaseUrl;
    }

    public List<CrawlProvider> getCrawlProviders() {
        return crawlProviders;
    }

    public void setCrawlProviders(List<CrawlProvider> crawlProviders) {
        this.crawlProviders = crawlProviders;
    }

    /**
     * Crawl providers in fallback order. Without an explicit list the single crawl service at
     * {@code crawl-base-url} is used.
     */
    public List<CrawlProvider> effectiveCrawlProviders() {
        if (!crawlProviders.isEmpty()) {
            return crawlProviders;
        }
        CrawlProvider only = new CrawlProvider();
        only.setName("crawl-service");
        only.setBaseUrl(crawlBaseUrl);
        return List.of(only);
    }

    public String getEscalationBaseUrl() {
        return escalationBaseUrl;
    }

    public void setEscalationBaseUrl(String escalationBaseUrl) {
        this.escalationBaseUrl = escalationBaseUrl;
    }

    public String getEscalationApiKey() {
        return escalationApiKey;
    }

    public void setEscalationApiKey(String escalationApiKey) {
        this.escalationApiKey = escalationApiKey;
    }

    public String getGenerationBaseUrl() {
        return generationBaseUrl;
    }

    public void setGenerationBaseUrl(String generationBaseUrl) {
        this.generationBaseUrl = generationBaseUrl;
    }

    public String getMediaBaseUrl() {
        return mediaBaseUrl;
    }

    public void setMediaBaseUrl(String mediaBaseUrl) {
        this.mediaBaseUrl = mediaBaseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public static class CrawlProvider {

        private String name;
        private String baseUrl;
        private String path = "/crawl";
        private String apiKey = "";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
