package com.phoenix.worker.client;

public record SearchHit(
    String url,
    String title,
    String snippet,
    int rank
) {
}
