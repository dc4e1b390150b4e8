package com.phoenix.worker.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SerperNewsResponse(
    List<Item> news
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
        String link,
        String title,
        String snippet,
        String source,
        String date,
        Integer position
    ) {
    }
}
