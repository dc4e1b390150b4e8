package com.phoenix.worker.config;

import com.phoenix.worker.client.CrawlService;
import com.phoenix.worker.client.FallbackCrawlService;
import com.phoenix.worker.client.HttpCrawlService;
import java.time.Duration;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    @Bean
    RestClient knowledgeRestClient(RestClient.Builder builder, ProviderProperties properties) {
        return builder.clone()
            .baseUrl(properties.getKnowledgeBaseUrl())
            .defaultHeader("Authorization", "Api-Key " + properties.getKnowledgeApiKey())
            .requestFactory(requestFactory(properties))
            .build();
    }

    @Bean
    RestClient searchRestClient(RestClient.Builder builder, ProviderProperties properties) {
        return builder.clone()
            .baseUrl(properties.getSearchBaseUrl())
            .defaultHeader("X-API-KEY", properties.getSearchApiKey())
            .requestFactory(requestFactory(properties))
            .build();
    }

    @Bean
    CrawlService crawlService(RestClient.Builder builder, ProviderProperties properties) {
        List<CrawlService> chain = new ArrayList<>();
        for (ProviderProperties.CrawlProvider provider : properties.effectiveCrawlProviders()) {
            RestClient.Builder client = builder.clone()
                .baseUrl(provider.getBaseUrl())
                .requestFactory(requestFactory(properties));
            if (provider.getApiKey() != null && !provider.getApiKey().isBlank()) {
                client.defaultHeader("Authorization", "Bearer " + provider.getApiKey());
            }
            chain.add(new HttpCrawlService(provider.getName(), client.build(), provider.getPath()));
        }
        return new FallbackCrawlService(chain);
    }

    @Bean
    @ConditionalOnProperty(prefix = "providers", name = "escalation-base-url")
    RestClient escalationRestClient(RestClient.Builder builder, ProviderProperties properties) {
        return builder.clone()
            .baseUrl(properties.getEscalationBaseUrl())
            .defaultHeader("Authorization", "Bearer " + properties.getEscalationApiKey())
            .requestFactory(requestFactory(properties))
            .build();
    }

    @Bean
    RestClient generationRestClient(RestClient.Builder builder, ProviderProperties properties) {
        return builder.clone()
            .baseUrl(properties.getGenerationBaseUrl())
            .requestFactory(requestFactory(properties))
            .build();
    }

    @Bean
    RestClient mediaRestClient(RestClient.Builder builder, ProviderProperties properties) {
        return builder.clone()
            .baseUrl(properties.getMediaBaseUrl())
            .requestFactory(requestFactory(properties))
            .build();
    }

    private JdkClientHttpRequestFactory requestFactory(ProviderProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()));
        return factory;
    }
}
