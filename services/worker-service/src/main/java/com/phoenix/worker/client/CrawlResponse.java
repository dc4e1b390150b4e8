package com.phoenix.worker.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawlResponse(
    boolean success,
    String url,
    String title,
    String content,
    Map<String, String> facts,
    String error
) {
}
