package com.phoenix.worker.domain;

public record MediaAsset(
    String role,
    String url
) {
}
