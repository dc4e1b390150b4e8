package com.phoenix.worker.client;

import java.util.Map;

public record CrawlPage(
    String url,
    String title,
    String text,
    Map<String, String> facts
) {

    public int wordCount() {
        return text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;
    }
}
